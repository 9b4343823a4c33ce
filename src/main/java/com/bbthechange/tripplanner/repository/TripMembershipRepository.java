package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.TripMembership;

import java.util.List;

/**
 * Trips a user has answered a collaboration invite for. Entries are written together with the
 * trip through {@link TripTransactionRepository}.
 */
public interface TripMembershipRepository {

    List<TripMembership> findByUserId(String userId);

    void delete(String userId, String tripId);
}
