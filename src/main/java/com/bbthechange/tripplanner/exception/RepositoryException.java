package com.bbthechange.tripplanner.exception;

/**
 * Store call failed. The write may or may not have been applied; callers should re-read.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
