package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Address verification state for an email that receives invitations.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class EmailVerification {

    public static final Duration VALIDITY = Duration.ofHours(24);

    private String email;
    private String token;
    private Boolean verified;
    private Instant requestedAt;
    private Instant expiresAt;
    private Instant verifiedAt;

    public EmailVerification(String email, String token, Instant now) {
        this.email = email;
        this.token = token;
        this.verified = false;
        this.requestedAt = now;
        this.expiresAt = now.plus(VALIDITY);
    }

    public boolean verificationComplete() {
        return Boolean.TRUE.equals(verified);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public void markVerified(Instant now) {
        this.verified = true;
        this.verifiedAt = now;
        this.token = null;
    }

    @DynamoDbPartitionKey
    public String getEmail() {
        return email;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "VerificationTokenIndex")
    public String getToken() {
        return token;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getRequestedAt() {
        return requestedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getVerifiedAt() {
        return verifiedAt;
    }
}
