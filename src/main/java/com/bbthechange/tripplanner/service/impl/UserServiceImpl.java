package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.AuthResponse;
import com.bbthechange.tripplanner.dto.LoginRequest;
import com.bbthechange.tripplanner.dto.RegisterRequest;
import com.bbthechange.tripplanner.dto.UserDTO;
import com.bbthechange.tripplanner.exception.ConflictException;
import com.bbthechange.tripplanner.exception.UnauthorizedException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.UserRepository;
import com.bbthechange.tripplanner.service.JwtService;
import com.bbthechange.tripplanner.service.PasswordService;
import com.bbthechange.tripplanner.service.UserService;
import com.bbthechange.tripplanner.util.EmailAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class UserServiceImpl implements UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserServiceImpl.class);
    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final JwtService jwtService;
    private final Clock clock;

    @Autowired
    public UserServiceImpl(UserRepository userRepository, PasswordService passwordService,
                           JwtService jwtService, Clock clock) {
        this.userRepository = userRepository;
        this.passwordService = passwordService;
        this.jwtService = jwtService;
        this.clock = clock;
    }

    @Override
    public AuthResponse register(RegisterRequest request) {
        String email = EmailAddresses.requireValid(request.getEmail());
        requireAcceptablePassword(request.getPassword());

        if (userRepository.findByEmail(email).isPresent()) {
            logger.warn("Registration rejected, email already registered: {}", email);
            throw new ConflictException("An account with this email already exists");
        }

        User user = new User(email, request.getName(), passwordService.hash(request.getPassword()), clock.instant());
        userRepository.save(user);
        logger.info("Registered user {}", user.getId());

        return new AuthResponse(UserDTO.from(user), jwtService.generateToken(user.getId()),
            jwtService.getAccessTokenExpirationSeconds());
    }

    @Override
    public AuthResponse login(LoginRequest request) {
        String email = EmailAddresses.normalize(request.getEmail());
        Optional<User> user = email == null ? Optional.empty() : userRepository.findByEmail(email);

        if (user.isEmpty() || !passwordService.matches(request.getPassword(), user.get().getPasswordHash())) {
            logger.warn("Failed login for {}", email);
            throw new UnauthorizedException("Invalid email or password");
        }

        logger.debug("User {} logged in", user.get().getId());
        return new AuthResponse(UserDTO.from(user.get()), jwtService.generateToken(user.get().getId()),
            jwtService.getAccessTokenExpirationSeconds());
    }

    @Override
    public UserDTO getCurrentUser(String userId) {
        return UserDTO.from(requireUser(userId));
    }

    @Override
    public User requireUser(String userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UnauthorizedException("User account not found"));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return userRepository.findByEmail(normalized);
    }

    @Override
    public Optional<User> findById(String userId) {
        return userRepository.findById(userId);
    }

    static void requireAcceptablePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }
}
