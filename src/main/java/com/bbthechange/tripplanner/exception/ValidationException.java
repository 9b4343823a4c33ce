package com.bbthechange.tripplanner.exception;

/**
 * Malformed request input: unknown role, bad email, missing fields.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
