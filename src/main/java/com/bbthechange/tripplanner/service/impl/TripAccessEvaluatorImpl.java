package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.exception.ForbiddenException;
import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.RolePermissions;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.service.TripAccessEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure access checks over the trip document. No store access, no side effects.
 */
@Service
public class TripAccessEvaluatorImpl implements TripAccessEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(TripAccessEvaluatorImpl.class);

    @Override
    public boolean canAccess(Trip trip, String requesterId, Capability capability) {
        return effectiveCapabilities(trip, requesterId).contains(capability);
    }

    @Override
    public void requireAccess(Trip trip, String requesterId, Capability capability) {
        if (!canAccess(trip, requesterId, capability)) {
            logger.warn("User {} lacks {} on trip {}", requesterId, capability.getValue(), trip.getTripId());
            throw new ForbiddenException("You don't have permission to " + describe(capability) + " for this trip");
        }
    }

    @Override
    public Set<Capability> effectiveCapabilities(Trip trip, String requesterId) {
        if (trip == null || requesterId == null || requesterId.isEmpty()) {
            return EnumSet.noneOf(Capability.class);
        }
        if (trip.isOwnedBy(requesterId)) {
            return EnumSet.allOf(Capability.class);
        }
        return acceptedCollaborator(trip.getCollaborators(), requesterId)
            .map(c -> RolePermissions.capabilitiesFor(c.getRole()))
            .orElseGet(() -> EnumSet.noneOf(Capability.class));
    }

    // Pending and declined entries grant nothing, whatever their role.
    private Optional<Collaborator> acceptedCollaborator(List<Collaborator> collaborators, String requesterId) {
        if (collaborators == null) {
            return Optional.empty();
        }
        return collaborators.stream()
            .filter(c -> c.isAcceptedUser(requesterId))
            .findFirst();
    }

    private static String describe(Capability capability) {
        switch (capability) {
            case VIEW_TRIP:
                return "view";
            case EDIT_ITINERARY:
                return "edit the itinerary";
            case INVITE_OTHERS:
                return "invite collaborators";
            case MANAGE_SETTINGS:
                return "manage settings";
            default:
                return "do that";
        }
    }
}
