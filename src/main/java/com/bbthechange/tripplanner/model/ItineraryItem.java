package com.bbthechange.tripplanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.LocalDate;

/**
 * One stop of a trip itinerary.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class ItineraryItem {
    private Place place;
    private LocalDate date;
    private String startTime;
    private String endTime;
    private Integer estimatedDuration;  // minutes
    private String notes;
    private Integer order;
    private Boolean isCustom;
    private String customTitle;
    private String customDescription;

    public ItineraryItem(Place place, LocalDate date, int order) {
        this.place = place;
        this.date = date;
        this.order = order;
        this.estimatedDuration = 60;
        this.isCustom = false;
    }
}
