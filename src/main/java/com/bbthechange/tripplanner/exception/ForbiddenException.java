package com.bbthechange.tripplanner.exception;

/**
 * Authenticated caller lacks the capability the operation requires.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
