package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviteCollaboratorResponse {

    private String message;
    private CollaboratorDTO collaborator;
    private String inviteToken;
    private boolean emailSent;
    private boolean verificationRequired;
}
