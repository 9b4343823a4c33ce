package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.AcceptInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationRequest;
import com.bbthechange.tripplanner.dto.CreateInvitationResponse;
import com.bbthechange.tripplanner.dto.InvitationDTO;
import com.bbthechange.tripplanner.dto.InvitationDetailsDTO;
import com.bbthechange.tripplanner.dto.TripAccessDTO;
import com.bbthechange.tripplanner.exception.RateLimitExceededException;
import com.bbthechange.tripplanner.service.InvitationService;
import com.bbthechange.tripplanner.service.RateLimitingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Invitation links. Details are public so invitees without an account can see what they were invited to.
 */
@RestController
@Tag(name = "Invitations", description = "Co-editing invitation links")
public class InvitationController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(InvitationController.class);

    private final InvitationService invitationService;
    private final RateLimitingService rateLimitingService;

    @Autowired
    public InvitationController(InvitationService invitationService, RateLimitingService rateLimitingService) {
        this.invitationService = invitationService;
        this.rateLimitingService = rateLimitingService;
    }

    @PostMapping("/trips/{tripId}/invite-link")
    @Operation(summary = "Create an invitation link", description = "Requires invite_others.")
    public ResponseEntity<CreateInvitationResponse> createInvitationLink(@PathVariable String tripId,
                                                                         @Valid @RequestBody CreateInvitationRequest request,
                                                                         HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        CreateInvitationResponse response = invitationService.createInvitationLink(tripId, request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/invite/{token}/details")
    @Operation(summary = "Invitation, trip preview and granted permissions")
    public ResponseEntity<InvitationDetailsDTO> getInvitationDetails(@PathVariable String token,
                                                                     HttpServletRequest httpRequest) {
        String clientIp = clientIp(httpRequest);
        if (!rateLimitingService.isInviteDetailsLookupAllowed(clientIp)) {
            throw new RateLimitExceededException("Too many invitation lookups. Please try again later.");
        }
        return ResponseEntity.ok(invitationService.getInvitationDetails(token));
    }

    @PostMapping("/invite/accept")
    @Operation(summary = "Accept an invitation link as the signed-in user")
    public ResponseEntity<TripAccessDTO> acceptInvitation(@Valid @RequestBody AcceptInvitationRequest request,
                                                          HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        TripAccessDTO access = invitationService.acceptInvitation(request.getInviteToken(), userId);
        logger.info("User {} joined trip {} as {}", userId, access.getTripId(), access.getRole().getValue());
        return ResponseEntity.ok(access);
    }

    @GetMapping("/invitations/pending")
    @Operation(summary = "Pending invitations addressed to the caller's email")
    public ResponseEntity<List<InvitationDTO>> getPendingInvitations(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(invitationService.getPendingInvitations(userId));
    }

    @DeleteMapping("/invite/{token}")
    @Operation(summary = "Revoke a pending invitation", description = "Requires invite_others.")
    public ResponseEntity<Void> revokeInvitation(@PathVariable String token, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        invitationService.revokeInvitation(token, userId);
        return ResponseEntity.noContent().build();
    }
}
