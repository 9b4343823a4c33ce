package com.bbthechange.tripplanner.exception;

/**
 * Trip, user, invitation or token does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
