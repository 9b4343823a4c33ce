package com.bbthechange.tripplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.ArrayList;
import java.util.List;

/**
 * A location referenced from the itinerary or the wishlist.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Place {
    private String placeId;
    private String name;
    private String address;
    private Double latitude;
    private Double longitude;
    private List<String> types = new ArrayList<>();
    private Double rating;
    private List<String> photos = new ArrayList<>();

    public Place(String placeId, String name, String address) {
        this.placeId = placeId;
        this.name = name;
        this.address = address;
    }
}
