package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.TripToken;

import java.util.List;
import java.util.Optional;

/**
 * Secondary index from invitation/share tokens to the trip that embeds them.
 * Entries are written together with the trip through {@link TripTransactionRepository}.
 */
public interface TripTokenRepository {

    Optional<TripToken> findByToken(String token);

    boolean exists(String token);

    /**
     * Tokens of invitations addressed to the given (normalized) email.
     */
    List<TripToken> findByTargetEmail(String email);

    void delete(String token);
}
