package com.bbthechange.tripplanner.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static role to capability table.
 * Unknown or missing roles resolve to the viewer set, never to anything wider.
 */
public final class RolePermissions {

    private static final Map<TripRole, Set<Capability>> TABLE = new EnumMap<>(TripRole.class);

    static {
        TABLE.put(TripRole.VIEWER, Collections.unmodifiableSet(
            EnumSet.of(Capability.VIEW_TRIP)));
        TABLE.put(TripRole.EDITOR, Collections.unmodifiableSet(
            EnumSet.of(Capability.VIEW_TRIP, Capability.EDIT_ITINERARY)));
        TABLE.put(TripRole.ADMIN, Collections.unmodifiableSet(
            EnumSet.allOf(Capability.class)));
    }

    private RolePermissions() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Set<Capability> capabilitiesFor(TripRole role) {
        if (role == null) {
            return TABLE.get(TripRole.VIEWER);
        }
        return TABLE.get(role);
    }

    public static Set<Capability> capabilitiesFor(String role) {
        return capabilitiesFor(TripRole.find(role).orElse(TripRole.VIEWER));
    }

    public static boolean grants(TripRole role, Capability capability) {
        return capabilitiesFor(role).contains(capability);
    }
}
