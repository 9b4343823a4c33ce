package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.ItineraryItem;
import com.bbthechange.tripplanner.model.Place;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Trip as seen by its owner and collaborators.
 * Invitations and share links are served by their own endpoints.
 */
@Data
@NoArgsConstructor
public class TripDTO {

    private String tripId;
    private String ownerId;
    private String title;
    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer duration;
    private TripStatus status;
    private Boolean isPublic;
    private BigDecimal totalBudget;
    private String currency;
    private List<ItineraryItem> itinerary;
    private List<Place> wishlist;
    private List<CollaboratorDTO> collaborators;
    private Instant createdAt;
    private Instant updatedAt;
    private PermissionsDTO permissions;

    public static TripDTO from(Trip trip, PermissionsDTO permissions) {
        TripDTO dto = new TripDTO();
        dto.tripId = trip.getTripId();
        dto.ownerId = trip.getOwnerId();
        dto.title = trip.getTitle();
        dto.description = trip.getDescription();
        dto.destination = trip.getDestination();
        dto.startDate = trip.getStartDate();
        dto.endDate = trip.getEndDate();
        dto.duration = trip.getDuration();
        dto.status = trip.getStatus();
        dto.isPublic = trip.getIsPublic();
        dto.totalBudget = trip.getTotalBudget();
        dto.currency = trip.getCurrency();
        dto.itinerary = trip.getItinerary();
        dto.wishlist = trip.getWishlist();
        dto.collaborators = trip.getCollaborators() == null ? List.of() : trip.getCollaborators().stream()
            .map(CollaboratorDTO::from)
            .collect(Collectors.toList());
        dto.createdAt = trip.getCreatedAt();
        dto.updatedAt = trip.getUpdatedAt();
        dto.permissions = permissions;
        return dto;
    }
}
