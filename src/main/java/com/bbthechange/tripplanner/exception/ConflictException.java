package com.bbthechange.tripplanner.exception;

/**
 * Duplicate collaborator, duplicate account email, or caller already has access.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
