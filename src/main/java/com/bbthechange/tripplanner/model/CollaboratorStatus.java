package com.bbthechange.tripplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CollaboratorStatus {
    PENDING,
    ACCEPTED,
    DECLINED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
