package com.bbthechange.tripplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sign-up through an invitation link. The account and the trip membership are created together.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWithInviteRequest {

    private String name;

    @NotBlank(message = "Email is required")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 6, message = "Password must be at least 6 characters")
    private String password;

    @NotBlank(message = "Invite token is required")
    private String inviteToken;
}
