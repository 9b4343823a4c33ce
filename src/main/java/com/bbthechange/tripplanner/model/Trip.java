package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Trip document. Collaborators, invitations and share links are embedded and never deleted;
 * every change to them is a read-modify-write of the whole item guarded by {@link #getVersion()}.
 *
 * DynamoDB Keys:
 *   PK: tripId
 *   GSI (OwnerIndex): ownerId
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Trip {

    private String tripId;
    private String ownerId;
    private String title;
    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer duration;
    private TripStatus status;
    private Boolean isPublic;
    private BigDecimal totalBudget;
    private String currency;
    private List<ItineraryItem> itinerary = new ArrayList<>();
    private List<Place> wishlist = new ArrayList<>();
    private List<Collaborator> collaborators = new ArrayList<>();
    private List<Invitation> invitations = new ArrayList<>();
    private List<ShareLink> shareLinks = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;

    public Trip(String ownerId, String title, String destination, LocalDate startDate, LocalDate endDate, Instant now) {
        this.tripId = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.title = title;
        this.description = "";
        this.destination = destination;
        this.startDate = startDate;
        this.endDate = endDate;
        this.duration = calculateDuration(startDate, endDate);
        this.status = TripStatus.PLANNING;
        this.isPublic = false;
        this.totalBudget = BigDecimal.ZERO;
        this.currency = "USD";
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Inclusive day count between the two dates, never less than one.
     */
    public static int calculateDuration(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            return 1;
        }
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        return (int) Math.max(1, days);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public Optional<Collaborator> collaboratorForUser(String userId) {
        if (userId == null || collaborators == null) {
            return Optional.empty();
        }
        return collaborators.stream()
            .filter(c -> userId.equals(c.getUserId()))
            .findFirst();
    }

    public Optional<Collaborator> collaboratorForEmail(String email) {
        if (email == null || collaborators == null) {
            return Optional.empty();
        }
        return collaborators.stream()
            .filter(c -> email.equalsIgnoreCase(c.getEmail()))
            .findFirst();
    }

    public Optional<Collaborator> collaboratorForInviteToken(String token) {
        if (token == null || collaborators == null) {
            return Optional.empty();
        }
        return collaborators.stream()
            .filter(c -> token.equals(c.getInviteToken()))
            .findFirst();
    }

    public Optional<Invitation> invitationForToken(String token) {
        if (token == null || invitations == null) {
            return Optional.empty();
        }
        return invitations.stream()
            .filter(i -> token.equals(i.getToken()))
            .findFirst();
    }

    public Optional<ShareLink> shareLinkForToken(String token) {
        if (token == null || shareLinks == null) {
            return Optional.empty();
        }
        return shareLinks.stream()
            .filter(s -> token.equals(s.getToken()))
            .findFirst();
    }

    public void addCollaborator(Collaborator collaborator) {
        if (collaborators == null) {
            collaborators = new ArrayList<>();
        }
        collaborators.add(collaborator);
    }

    public void addInvitation(Invitation invitation) {
        if (invitations == null) {
            invitations = new ArrayList<>();
        }
        invitations.add(invitation);
    }

    public void addShareLink(ShareLink shareLink) {
        if (shareLinks == null) {
            shareLinks = new ArrayList<>();
        }
        shareLinks.add(shareLink);
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    @DynamoDbPartitionKey
    public String getTripId() {
        return tripId;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "OwnerIndex")
    public String getOwnerId() {
        return ownerId;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @DynamoDbVersionAttribute
    public Long getVersion() {
        return version;
    }
}
