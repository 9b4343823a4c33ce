package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvitationDetailsDTO {

    private InvitationDTO invitation;
    private TripPreviewDTO trip;
    private PermissionsDTO permissions;
}
