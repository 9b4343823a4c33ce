package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;

/**
 * User to trip pointer for trips the user collaborates on. Written in the same transaction as the
 * collaborator entry it mirrors; role and status are always read from the trip document itself.
 * Title is denormalized so listings can be logged without loading the trip.
 *
 * DynamoDB Keys:
 *   PK: userId
 *   SK: tripId
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class TripMembership {
    private String userId;
    private String tripId;
    private String tripTitle;
    private Instant joinedAt;

    public TripMembership(String userId, Trip trip, Instant joinedAt) {
        this.userId = userId;
        this.tripId = trip.getTripId();
        this.tripTitle = trip.getTitle();
        this.joinedAt = joinedAt;
    }

    @DynamoDbPartitionKey
    public String getUserId() {
        return userId;
    }

    @DynamoDbSortKey
    public String getTripId() {
        return tripId;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getJoinedAt() {
        return joinedAt;
    }
}
