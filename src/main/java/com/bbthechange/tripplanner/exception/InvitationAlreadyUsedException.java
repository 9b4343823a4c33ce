package com.bbthechange.tripplanner.exception;

/**
 * Invitation or collaborator invite whose status is no longer pending.
 */
public class InvitationAlreadyUsedException extends RuntimeException {

    public InvitationAlreadyUsedException(String message) {
        super(message);
    }
}
