package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.Capability;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Flattened capability set as shown to clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PermissionsDTO {

    private boolean canView;
    private boolean canEdit;
    private boolean canInvite;
    private boolean canManage;

    public static PermissionsDTO of(Set<Capability> capabilities) {
        return new PermissionsDTO(
            capabilities.contains(Capability.VIEW_TRIP),
            capabilities.contains(Capability.EDIT_ITINERARY),
            capabilities.contains(Capability.INVITE_OTHERS),
            capabilities.contains(Capability.MANAGE_SETTINGS));
    }

    public static PermissionsDTO none() {
        return new PermissionsDTO(false, false, false, false);
    }
}
