package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Public access token for a filtered, read-only view of a trip.
 * Inert forever once expiresAt has passed.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class ShareLink {

    public static final int DEFAULT_EXPIRY_DAYS = 30;

    private String id;
    private String token;
    private String tripId;
    private String createdBy;
    private ShareSettings settings;
    private Long accessCount;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastAccessed;

    public ShareLink(String token, String tripId, String createdBy, ShareSettings settings, Instant now, int expiresInDays) {
        this.id = UUID.randomUUID().toString();
        this.token = token;
        this.tripId = tripId;
        this.createdBy = createdBy;
        this.settings = settings;
        this.accessCount = 0L;
        this.createdAt = now;
        this.expiresAt = now.plus(Duration.ofDays(expiresInDays));
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public void recordAccess(Instant now) {
        this.accessCount = (accessCount == null ? 0L : accessCount) + 1;
        this.lastAccessed = now;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastAccessed() {
        return lastAccessed;
    }
}
