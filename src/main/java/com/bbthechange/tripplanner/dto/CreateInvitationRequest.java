package com.bbthechange.tripplanner.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateInvitationRequest {

    @NotBlank(message = "Role is required")
    private String role;

    private String email;

    @Size(max = 1000, message = "Message must be at most 1000 characters")
    private String message;

    @Min(value = 1, message = "Invitations must be valid for at least 1 day")
    @Max(value = 30, message = "Invitations can be valid for at most 30 days")
    private Integer expiresInDays;

    private Boolean allowSignup;
}
