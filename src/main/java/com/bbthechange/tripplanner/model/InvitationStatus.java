package com.bbthechange.tripplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Invitation link states. Anything other than PENDING is terminal.
 */
public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    REVOKED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
