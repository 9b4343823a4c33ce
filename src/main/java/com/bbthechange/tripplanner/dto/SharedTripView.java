package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.ItineraryItem;
import com.bbthechange.tripplanner.model.Place;
import com.bbthechange.tripplanner.model.ShareLink;
import com.bbthechange.tripplanner.model.Trip;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only projection served through a share link.
 * Collaborators, owner identity and other share links are never part of it.
 */
@Data
@NoArgsConstructor
public class SharedTripView {

    private String id;
    private String title;
    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer duration;
    private List<ItineraryItem> itinerary;
    private List<Place> wishlist;
    private Boolean isShared;
    private ShareSettingsDTO shareSettings;

    public static SharedTripView of(Trip trip, ShareLink link) {
        SharedTripView view = new SharedTripView();
        view.id = trip.getTripId();
        view.title = trip.getTitle();
        view.description = trip.getDescription();
        view.destination = trip.getDestination();
        view.startDate = trip.getStartDate();
        view.endDate = trip.getEndDate();
        view.duration = trip.getDuration();
        view.itinerary = trip.getItinerary() == null ? List.of() : trip.getItinerary();
        view.wishlist = trip.getWishlist() == null ? List.of() : trip.getWishlist();
        view.isShared = true;
        view.shareSettings = ShareSettingsDTO.from(link.getSettings());
        return view;
    }
}
