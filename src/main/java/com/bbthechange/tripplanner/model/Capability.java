package com.bbthechange.tripplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named permissions an actor may hold on a trip.
 */
public enum Capability {
    VIEW_TRIP("view_trip"),
    EDIT_ITINERARY("edit_itinerary"),
    INVITE_OTHERS("invite_others"),
    MANAGE_SETTINGS("manage_settings");

    private final String value;

    Capability(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
