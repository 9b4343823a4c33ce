package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.CollaboratorStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviteResponseResult {

    private String tripId;
    private String tripTitle;
    private CollaboratorStatus status;
    private TripAccessDTO tripAccess;
}
