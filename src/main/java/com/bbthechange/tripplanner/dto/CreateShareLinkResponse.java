package com.bbthechange.tripplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateShareLinkResponse {

    private String message;
    private ShareLinkDTO shareLink;
    private boolean emailSent;
}
