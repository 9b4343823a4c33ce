package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.Trip;

import java.util.List;
import java.util.Optional;

/**
 * Key-value access to trip documents.
 *
 * Writes are whole-document and versioned: {@link #update(Trip)} only succeeds when the stored
 * version equals the version the caller read.
 */
public interface TripRepository {

    /**
     * Store a new trip. Fails if a trip with the same id already exists.
     *
     * @return the stored trip, carrying its initial version
     */
    Trip create(Trip trip);

    Optional<Trip> findById(String tripId);

    /**
     * Trips owned by the user (OwnerIndex GSI), newest first.
     */
    List<Trip> findByOwnerId(String ownerId);

    /**
     * Conditional write of the whole document.
     *
     * @return the stored trip with its incremented version
     * @throws com.bbthechange.tripplanner.exception.VersionConflictException if the trip changed since it was read
     */
    Trip update(Trip trip);

    void delete(String tripId);
}
