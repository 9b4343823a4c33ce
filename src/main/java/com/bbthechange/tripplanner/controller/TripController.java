package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.CollaborationTripDTO;
import com.bbthechange.tripplanner.dto.CreateTripRequest;
import com.bbthechange.tripplanner.dto.TripDTO;
import com.bbthechange.tripplanner.dto.UpdateItineraryRequest;
import com.bbthechange.tripplanner.dto.UpdateTripRequest;
import com.bbthechange.tripplanner.model.Place;
import com.bbthechange.tripplanner.service.TripService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/trips")
@Tag(name = "Trips", description = "Trip planning, itinerary and wishlist")
@SecurityRequirement(name = "Bearer Authentication")
public class TripController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(TripController.class);

    private final TripService tripService;

    @Autowired
    public TripController(TripService tripService) {
        this.tripService = tripService;
    }

    @GetMapping
    @Operation(summary = "Trips owned by the caller, newest first")
    public ResponseEntity<List<TripDTO>> getTrips(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.getTrips(userId));
    }

    @GetMapping("/shared")
    @Operation(summary = "Trips the caller collaborates on or was invited to",
               description = "Each trip carries the caller's role and invite status.")
    public ResponseEntity<List<CollaborationTripDTO>> getSharedTrips(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.getSharedTrips(userId));
    }

    @PostMapping
    @Operation(summary = "Create a trip")
    public ResponseEntity<TripDTO> createTrip(@Valid @RequestBody CreateTripRequest request,
                                              HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        TripDTO trip = tripService.createTrip(request, userId);
        logger.info("Created trip {} for user {}", trip.getTripId(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(trip);
    }

    @GetMapping("/{tripId}")
    @Operation(summary = "Trip details", description = "Requires view_trip.")
    public ResponseEntity<TripDTO> getTrip(@PathVariable String tripId, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.getTrip(tripId, userId));
    }

    @PutMapping("/{tripId}")
    @Operation(summary = "Update trip settings", description = "Requires manage_settings.")
    public ResponseEntity<TripDTO> updateTrip(@PathVariable String tripId,
                                              @Valid @RequestBody UpdateTripRequest request,
                                              HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.updateTrip(tripId, request, userId));
    }

    @DeleteMapping("/{tripId}")
    @Operation(summary = "Delete a trip", description = "Owner only.")
    public ResponseEntity<Void> deleteTrip(@PathVariable String tripId, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        tripService.deleteTrip(tripId, userId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{tripId}/itinerary")
    @Operation(summary = "Replace the itinerary", description = "Requires edit_itinerary.")
    public ResponseEntity<TripDTO> updateItinerary(@PathVariable String tripId,
                                                   @Valid @RequestBody UpdateItineraryRequest request,
                                                   HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.updateItinerary(tripId, request, userId));
    }

    @PostMapping("/{tripId}/wishlist")
    @Operation(summary = "Add a place to the wishlist", description = "Requires edit_itinerary.")
    public ResponseEntity<TripDTO> addWishlistPlace(@PathVariable String tripId,
                                                    @RequestBody Place place,
                                                    HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.addWishlistPlace(tripId, place, userId));
    }

    @DeleteMapping("/{tripId}/wishlist/{placeId}")
    @Operation(summary = "Remove a place from the wishlist", description = "Requires edit_itinerary.")
    public ResponseEntity<TripDTO> removeWishlistPlace(@PathVariable String tripId,
                                                       @PathVariable String placeId,
                                                       HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(tripService.removeWishlistPlace(tripId, placeId, userId));
    }
}
