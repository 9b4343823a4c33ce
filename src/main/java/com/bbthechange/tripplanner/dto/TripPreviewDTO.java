package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.Trip;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripPreviewDTO {

    private String id;
    private String title;
    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;
    private String ownerName;

    public static TripPreviewDTO from(Trip trip, String ownerName) {
        return new TripPreviewDTO(trip.getTripId(), trip.getTitle(), trip.getDescription(),
            trip.getDestination(), trip.getStartDate(), trip.getEndDate(), ownerName);
    }
}
