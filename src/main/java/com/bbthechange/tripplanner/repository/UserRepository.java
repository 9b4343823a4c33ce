package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.User;

import java.util.Optional;

public interface UserRepository {

    User save(User user);

    Optional<User> findById(String id);

    /**
     * Lookup by normalized email (EmailIndex GSI).
     */
    Optional<User> findByEmail(String email);
}
