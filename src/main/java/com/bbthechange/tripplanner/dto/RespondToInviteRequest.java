package com.bbthechange.tripplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RespondToInviteRequest {

    @NotBlank(message = "Invite token is required")
    private String inviteToken;

    @NotBlank(message = "Action is required")
    @Pattern(regexp = "accept|decline", message = "Action must be accept or decline")
    private String action;

    public boolean isAccept() {
        return "accept".equals(action);
    }
}
