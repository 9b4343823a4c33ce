package com.bbthechange.tripplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TripStatus {
    PLANNING,
    ONGOING,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TripStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return TripStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
