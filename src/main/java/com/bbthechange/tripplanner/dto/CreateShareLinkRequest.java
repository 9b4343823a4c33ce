package com.bbthechange.tripplanner.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CreateShareLinkRequest {

    private Boolean isPublic;
    private Boolean allowComments;
    private Boolean passwordProtected;
    private String password;

    @Min(value = 1, message = "Share links must be valid for at least 1 day")
    @Max(value = 365, message = "Share links can be valid for at most 365 days")
    private Integer expiresInDays;

    private Boolean sendEmail;
}
