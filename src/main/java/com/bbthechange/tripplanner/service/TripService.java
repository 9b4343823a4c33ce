package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.CollaborationTripDTO;
import com.bbthechange.tripplanner.dto.CreateTripRequest;
import com.bbthechange.tripplanner.dto.TripDTO;
import com.bbthechange.tripplanner.dto.UpdateItineraryRequest;
import com.bbthechange.tripplanner.dto.UpdateTripRequest;
import com.bbthechange.tripplanner.model.Place;

import java.util.List;

public interface TripService {

    List<TripDTO> getTrips(String userId);

    /**
     * Trips the caller was invited to collaborate on, with their role and invite status, newest invite first.
     */
    List<CollaborationTripDTO> getSharedTrips(String userId);

    TripDTO createTrip(CreateTripRequest request, String userId);

    TripDTO getTrip(String tripId, String userId);

    TripDTO updateTrip(String tripId, UpdateTripRequest request, String userId);

    void deleteTrip(String tripId, String userId);

    TripDTO updateItinerary(String tripId, UpdateItineraryRequest request, String userId);

    TripDTO addWishlistPlace(String tripId, Place place, String userId);

    TripDTO removeWishlistPlace(String tripId, String placeId, String userId);
}
