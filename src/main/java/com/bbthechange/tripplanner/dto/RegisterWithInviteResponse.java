package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWithInviteResponse {

    private UserDTO user;
    private String token;
    private int expiresIn;
    private TripAccessDTO tripAccess;
}
