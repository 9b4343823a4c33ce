package com.bbthechange.tripplanner.model;

/**
 * Kind of record a globally unique token points at inside a trip document.
 */
public enum TripTokenType {
    INVITATION,
    COLLABORATOR_INVITE,
    SHARE_LINK
}
