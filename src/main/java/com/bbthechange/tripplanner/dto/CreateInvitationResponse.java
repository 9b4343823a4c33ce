package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateInvitationResponse {

    private String message;
    private InvitationDTO invitation;
    private boolean emailSent;
}
