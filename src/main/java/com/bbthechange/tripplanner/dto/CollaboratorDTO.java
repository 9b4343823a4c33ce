package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.CollaboratorStatus;
import com.bbthechange.tripplanner.model.RolePermissions;
import com.bbthechange.tripplanner.model.TripRole;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Collaborator entry without its invite token.
 */
@Data
@NoArgsConstructor
public class CollaboratorDTO {

    private String userId;
    private String email;
    private String name;
    private TripRole role;
    private CollaboratorStatus status;
    private String invitedBy;
    private Instant invitedAt;
    private Instant respondedAt;
    private Instant acceptedAt;
    private PermissionsDTO permissions;

    public static CollaboratorDTO from(Collaborator collaborator) {
        CollaboratorDTO dto = new CollaboratorDTO();
        dto.userId = collaborator.getUserId();
        dto.email = collaborator.getEmail();
        dto.name = collaborator.getName();
        dto.role = collaborator.getRole();
        dto.status = collaborator.getStatus();
        dto.invitedBy = collaborator.getInvitedBy();
        dto.invitedAt = collaborator.getInvitedAt();
        dto.respondedAt = collaborator.getRespondedAt();
        dto.acceptedAt = collaborator.getAcceptedAt();
        dto.permissions = PermissionsDTO.of(RolePermissions.capabilitiesFor(collaborator.getRole()));
        return dto;
    }
}
