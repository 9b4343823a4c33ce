package com.bbthechange.tripplanner.model;

import com.bbthechange.tripplanner.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Collaborator roles on a trip. The wire form is the lower-case value.
 */
public enum TripRole {
    VIEWER("viewer"),
    EDITOR("editor"),
    ADMIN("admin");

    private final String value;

    TripRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup, case-insensitive. Empty for null or unknown input.
     */
    public static Optional<TripRole> find(String role) {
        if (role == null) {
            return Optional.empty();
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        for (TripRole candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Strict lookup used for request input.
     *
     * @throws ValidationException if the role is not one of viewer, editor, admin
     */
    public static TripRole parse(String role) {
        return find(role).orElseThrow(() ->
            new ValidationException("Role must be viewer, editor, or admin"));
    }
}
