package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.model.Capability;
import com.bbthechange.tripplanner.model.Trip;

import java.util.Set;

/**
 * Decides which capabilities a requester holds on a trip.
 * The owner holds every capability; other users only through an accepted collaborator entry.
 */
public interface TripAccessEvaluator {

    boolean canAccess(Trip trip, String requesterId, Capability capability);

    /**
     * @throws com.bbthechange.tripplanner.exception.ForbiddenException if the capability is not held
     */
    void requireAccess(Trip trip, String requesterId, Capability capability);

    Set<Capability> effectiveCapabilities(Trip trip, String requesterId);
}
