package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * A user granted access to a trip other than ownership.
 * Embedded in the trip document; at most one entry per email.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Collaborator {
    private String userId;          // empty until the invitee has an account
    private String email;
    private String name;
    private TripRole role;
    private String invitedBy;
    private Instant invitedAt;
    private CollaboratorStatus status;
    private String inviteToken;     // back-reference only
    private Instant respondedAt;
    private Instant acceptedAt;

    public Collaborator(String userId, String email, String name, TripRole role, String invitedBy, Instant invitedAt) {
        this.userId = userId != null ? userId : "";
        this.email = email;
        this.name = name;
        this.role = role;
        this.invitedBy = invitedBy;
        this.invitedAt = invitedAt;
        this.status = CollaboratorStatus.PENDING;
    }

    public boolean isAcceptedUser(String requesterId) {
        return requesterId != null
            && requesterId.equals(userId)
            && status == CollaboratorStatus.ACCEPTED;
    }

    public void accept(String acceptingUserId, Instant now) {
        this.userId = acceptingUserId;
        this.status = CollaboratorStatus.ACCEPTED;
        this.respondedAt = now;
        this.acceptedAt = now;
    }

    public void decline(Instant now) {
        this.status = CollaboratorStatus.DECLINED;
        this.respondedAt = now;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getInvitedAt() {
        return invitedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getRespondedAt() {
        return respondedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getAcceptedAt() {
        return acceptedAt;
    }
}
