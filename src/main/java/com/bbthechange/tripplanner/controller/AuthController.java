package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.AuthResponse;
import com.bbthechange.tripplanner.dto.LoginRequest;
import com.bbthechange.tripplanner.dto.RegisterRequest;
import com.bbthechange.tripplanner.dto.RegisterWithInviteRequest;
import com.bbthechange.tripplanner.dto.RegisterWithInviteResponse;
import com.bbthechange.tripplanner.dto.UserDTO;
import com.bbthechange.tripplanner.service.InvitationService;
import com.bbthechange.tripplanner.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Accounts and sessions")
public class AuthController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final UserService userService;
    private final InvitationService invitationService;

    @Autowired
    public AuthController(UserService userService, InvitationService invitationService) {
        this.userService = userService;
        this.invitationService = invitationService;
    }

    @PostMapping("/register")
    @Operation(summary = "Create an account and start a session")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = userService.register(request);
        logger.info("Registered user {}", response.getUser().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/login")
    @Operation(summary = "Sign in with email and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(userService.login(request));
    }

    @PostMapping("/register-with-invite")
    @Operation(summary = "Create an account through an invitation link",
               description = "Creates the account, the session and the trip membership in one call. "
                   + "Fails with 409 when the email already has an account.")
    public ResponseEntity<RegisterWithInviteResponse> registerWithInvite(@Valid @RequestBody RegisterWithInviteRequest request) {
        RegisterWithInviteResponse response = invitationService.registerWithInvite(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/me")
    @Operation(summary = "Current user")
    public ResponseEntity<UserDTO> me(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(userService.getCurrentUser(userId));
    }
}
