package com.bbthechange.tripplanner.util;

import com.bbthechange.tripplanner.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

public final class EmailAddresses {

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private EmailAddresses() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Trim and lower-case. Returns null for null input.
     */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    /**
     * Normalize and validate in one step.
     *
     * @throws ValidationException if the address is missing or malformed
     */
    public static String requireValid(String email) {
        String normalized = normalize(email);
        if (!isValid(normalized)) {
            throw new ValidationException("Please provide a valid email address");
        }
        return normalized;
    }
}
