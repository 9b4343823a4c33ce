package com.bbthechange.tripplanner.exception;

/**
 * Optimistic locking conflict: the trip was modified since it was read.
 *
 * Trip mutations retry internally; this only reaches callers once the retries are exhausted.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
