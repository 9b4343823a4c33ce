package com.bbthechange.tripplanner.exception;

/**
 * Missing, invalid or expired session, or a share-link password that does not match.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
