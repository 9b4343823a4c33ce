package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.CollaboratorDTO;
import com.bbthechange.tripplanner.dto.InviteCollaboratorRequest;
import com.bbthechange.tripplanner.dto.InviteCollaboratorResponse;
import com.bbthechange.tripplanner.dto.InviteResponseResult;
import com.bbthechange.tripplanner.dto.RespondToInviteRequest;
import com.bbthechange.tripplanner.service.CollaboratorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Collaborators", description = "Direct collaborator invitations")
@SecurityRequirement(name = "Bearer Authentication")
public class CollaboratorController extends BaseController {

    private final CollaboratorService collaboratorService;

    @Autowired
    public CollaboratorController(CollaboratorService collaboratorService) {
        this.collaboratorService = collaboratorService;
    }

    @PostMapping("/trips/{tripId}/invite")
    @Operation(summary = "Invite a collaborator by email",
               description = "Requires invite_others. Returns 202 when the invitee must verify their address first.")
    public ResponseEntity<InviteCollaboratorResponse> inviteCollaborator(@PathVariable String tripId,
                                                                         @Valid @RequestBody InviteCollaboratorRequest request,
                                                                         HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        InviteCollaboratorResponse response = collaboratorService.inviteCollaborator(tripId, request, userId);
        HttpStatus status = response.isVerificationRequired() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/invite/respond")
    @Operation(summary = "Accept or decline a direct invitation")
    public ResponseEntity<InviteResponseResult> respondToInvite(@Valid @RequestBody RespondToInviteRequest request,
                                                                HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(collaboratorService.respondToInvite(request, userId));
    }

    @GetMapping("/trips/{tripId}/collaborators")
    @Operation(summary = "List collaborators", description = "Requires view_trip.")
    public ResponseEntity<List<CollaboratorDTO>> getCollaborators(@PathVariable String tripId,
                                                                  HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(collaboratorService.getCollaborators(tripId, userId));
    }
}
