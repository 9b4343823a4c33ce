package com.bbthechange.tripplanner.exception;

/**
 * Invitation used after its expiry instant.
 */
public class InvitationExpiredException extends RuntimeException {

    public InvitationExpiredException(String message) {
        super(message);
    }
}
