package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.ItineraryItem;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateItineraryRequest {

    @NotNull(message = "Itinerary is required")
    private List<ItineraryItem> itinerary;
}
