package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailVerificationStatusDTO {

    private String email;
    private Boolean verified;
    private Instant verifiedAt;
}
