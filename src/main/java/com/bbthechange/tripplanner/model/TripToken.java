package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.time.Instant;

/**
 * Token lookup record. Points a globally unique invitation or share token at the trip
 * document that embeds it, so resolution is a key lookup instead of a table scan.
 *
 * DynamoDB Keys:
 *   PK: token
 *   GSI (TargetEmailIndex): targetEmail, only set for invitations addressed to an email
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class TripToken {
    private String token;
    private TripTokenType tokenType;
    private String tripId;
    private String targetEmail;
    private Instant createdAt;

    public TripToken(String token, TripTokenType tokenType, String tripId, String targetEmail, Instant createdAt) {
        this.token = token;
        this.tokenType = tokenType;
        this.tripId = tripId;
        this.targetEmail = targetEmail;
        this.createdAt = createdAt;
    }

    @DynamoDbPartitionKey
    public String getToken() {
        return token;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "TargetEmailIndex")
    public String getTargetEmail() {
        return targetEmail;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }
}
