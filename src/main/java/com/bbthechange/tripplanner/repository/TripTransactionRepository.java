package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.User;

/**
 * Atomic multi-item writes spanning the trip document and its companion records.
 */
public interface TripTransactionRepository {

    /**
     * Versioned trip update plus a new token index entry, all or nothing.
     *
     * @return the trip with its incremented version
     * @throws com.bbthechange.tripplanner.exception.VersionConflictException if the trip changed or the token already exists
     */
    Trip updateTripWithToken(Trip trip, TripToken token);

    /**
     * Versioned trip update plus the caller's membership pointer, all or nothing.
     *
     * @return the trip with its incremented version
     * @throws com.bbthechange.tripplanner.exception.VersionConflictException if the trip changed since it was read
     */
    Trip updateTripWithMembership(Trip trip, TripMembership membership);

    /**
     * New user account, their membership pointer and the versioned trip update that makes them a collaborator.
     *
     * @return the trip with its incremented version
     * @throws com.bbthechange.tripplanner.exception.VersionConflictException if the trip changed since it was read
     */
    Trip createUserAndUpdateTrip(User user, Trip trip, TripMembership membership);
}
