package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.AuthResponse;
import com.bbthechange.tripplanner.dto.LoginRequest;
import com.bbthechange.tripplanner.dto.RegisterRequest;
import com.bbthechange.tripplanner.dto.UserDTO;
import com.bbthechange.tripplanner.model.User;

import java.util.Optional;

public interface UserService {

    AuthResponse register(RegisterRequest request);

    AuthResponse login(LoginRequest request);

    UserDTO getCurrentUser(String userId);

    /**
     * Loads the account behind an authenticated session.
     *
     * @throws com.bbthechange.tripplanner.exception.UnauthorizedException if the account no longer exists
     */
    User requireUser(String userId);

    Optional<User> findByEmail(String email);

    Optional<User> findById(String userId);
}
