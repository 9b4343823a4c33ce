package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.Collaborator;
import com.bbthechange.tripplanner.model.Invitation;
import com.bbthechange.tripplanner.model.InvitationStatus;
import com.bbthechange.tripplanner.model.TripRole;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Invitation as returned to the inviter and to invitees. {@code invite_type} tells the client how to
 * answer it: "link" invitations through /invite/accept, "direct" ones through /invite/respond.
 */
@Data
@NoArgsConstructor
public class InvitationDTO {

    public static final String TYPE_LINK = "link";
    public static final String TYPE_DIRECT = "direct";

    private String token;
    private String inviteType;
    private String url;
    private String tripId;
    private String tripTitle;
    private String inviterName;
    private String inviterEmail;
    private TripRole role;
    private String invitedEmail;
    private String message;
    private boolean requiresSignup;
    private InvitationStatus status;
    private Instant createdAt;
    private Instant expiresAt;

    public static InvitationDTO from(Invitation invitation, String tripTitle, String url) {
        InvitationDTO dto = new InvitationDTO();
        dto.token = invitation.getToken();
        dto.inviteType = TYPE_LINK;
        dto.url = url;
        dto.tripId = invitation.getTripId();
        dto.tripTitle = tripTitle;
        dto.inviterName = invitation.getInviterName();
        dto.inviterEmail = invitation.getInviterEmail();
        dto.role = invitation.getRole();
        dto.invitedEmail = invitation.getEmail();
        dto.message = invitation.getMessage();
        dto.requiresSignup = invitation.allowsSignup();
        dto.status = invitation.getStatus();
        dto.createdAt = invitation.getCreatedAt();
        dto.expiresAt = invitation.getExpiresAt();
        return dto;
    }

    /**
     * Pending direct collaborator invite. These never expire and need an existing account.
     */
    public static InvitationDTO fromCollaborator(Collaborator collaborator, String tripId, String tripTitle,
                                                 String inviterName, String url) {
        InvitationDTO dto = new InvitationDTO();
        dto.token = collaborator.getInviteToken();
        dto.inviteType = TYPE_DIRECT;
        dto.url = url;
        dto.tripId = tripId;
        dto.tripTitle = tripTitle;
        dto.inviterName = inviterName;
        dto.role = collaborator.getRole();
        dto.invitedEmail = collaborator.getEmail();
        dto.requiresSignup = false;
        dto.status = InvitationStatus.PENDING;
        dto.createdAt = collaborator.getInvitedAt();
        return dto;
    }
}
