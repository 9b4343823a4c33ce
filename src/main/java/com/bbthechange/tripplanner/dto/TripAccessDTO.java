package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.TripRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripAccessDTO {

    private String tripId;
    private String tripTitle;
    private TripRole role;
    private PermissionsDTO permissions;
}
