package com.bbthechange.tripplanner.exception;

/**
 * Share link resolved after its expiry instant. Links never come back from this state.
 */
public class ShareLinkExpiredException extends RuntimeException {

    public ShareLinkExpiredException(String message) {
        super(message);
    }
}
