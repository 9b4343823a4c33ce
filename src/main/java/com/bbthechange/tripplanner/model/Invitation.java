package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Duration;
import java.time.Instant;

/**
 * Co-editing invite link embedded in a trip.
 *
 * Single use: once status leaves PENDING the record is terminal and kept as history.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Invitation {

    public static final int DEFAULT_EXPIRY_DAYS = 7;

    private String token;
    private String tripId;
    private String inviterId;
    private String inviterName;
    private String inviterEmail;
    private TripRole role;
    private String email;           // optional target
    private String message;
    private Boolean allowSignup;
    private InvitationStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant usedAt;
    private String usedBy;

    public Invitation(String token, String tripId, User inviter, TripRole role, Instant now, int expiresInDays) {
        this.token = token;
        this.tripId = tripId;
        this.inviterId = inviter.getId();
        this.inviterName = inviter.getName();
        this.inviterEmail = inviter.getEmail();
        this.role = role;
        this.allowSignup = true;
        this.status = InvitationStatus.PENDING;
        this.createdAt = now;
        this.expiresAt = now.plus(Duration.ofDays(expiresInDays));
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }

    public boolean isTargeted() {
        return email != null && !email.isBlank();
    }

    public boolean allowsSignup() {
        return Boolean.TRUE.equals(allowSignup);
    }

    public void markUsed(String userId, Instant now) {
        this.status = InvitationStatus.ACCEPTED;
        this.usedAt = now;
        this.usedBy = userId;
    }

    public void revoke(String revokedBy, Instant now) {
        this.status = InvitationStatus.REVOKED;
        this.usedAt = now;
        this.usedBy = revokedBy;
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
    public Instant getUsedAt() {
        return usedAt;
    }
}
