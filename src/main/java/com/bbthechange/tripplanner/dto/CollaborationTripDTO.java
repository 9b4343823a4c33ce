package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripRole;
import com.bbthechange.tripplanner.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Trip someone else owns, as listed for a collaborator together with their own standing on it.
 */
@Data
@NoArgsConstructor
public class CollaborationTripDTO {

    private String tripId;
    private String title;
    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;
    private Owner owner;
    private Collaboration collaboration;
    private int itineraryCount;
    private int collaboratorsCount;
    private PermissionsDTO permissions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Owner {
        private String name;
        private String email;
    }

    @Data
    @NoArgsConstructor
    public static class Collaboration {
        private TripRole role;
        private CollaboratorStatus status;
        private Instant invitedAt;
        private Instant acceptedAt;
        private String inviteToken;     // only while the invite is pending
    }

    public static CollaborationTripDTO from(Trip trip, Collaborator collaborator, User owner, PermissionsDTO permissions) {
        CollaborationTripDTO dto = new CollaborationTripDTO();
        dto.tripId = trip.getTripId();
        dto.title = trip.getTitle();
        dto.description = trip.getDescription();
        dto.destination = trip.getDestination();
        dto.startDate = trip.getStartDate();
        dto.endDate = trip.getEndDate();
        dto.owner = owner == null ? null : new Owner(owner.getName(), owner.getEmail());
        dto.itineraryCount = trip.getItinerary() == null ? 0 : trip.getItinerary().size();
        dto.collaboratorsCount = trip.getCollaborators() == null ? 0 : trip.getCollaborators().size();
        dto.permissions = permissions;

        Collaboration collaboration = new Collaboration();
        collaboration.role = collaborator.getRole();
        collaboration.status = collaborator.getStatus();
        collaboration.invitedAt = collaborator.getInvitedAt();
        collaboration.acceptedAt = collaborator.getAcceptedAt();
        if (collaborator.getStatus() == CollaboratorStatus.PENDING) {
            collaboration.inviteToken = collaborator.getInviteToken();
        }
        dto.collaboration = collaboration;
        return dto;
    }
}
