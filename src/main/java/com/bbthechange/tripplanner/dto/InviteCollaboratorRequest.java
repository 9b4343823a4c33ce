package com.bbthechange.tripplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviteCollaboratorRequest {

    @NotBlank(message = "Email is required")
    private String email;

    private String role;

    @Size(max = 1000, message = "Message must be at most 1000 characters")
    private String message;
}
