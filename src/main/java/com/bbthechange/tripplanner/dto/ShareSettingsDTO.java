package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.ShareSettings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Share settings with the password hash stripped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareSettingsDTO {

    private Boolean isPublic;
    private Boolean allowComments;
    private Boolean passwordProtected;

    public static ShareSettingsDTO from(ShareSettings settings) {
        if (settings == null) {
            return new ShareSettingsDTO(false, false, false);
        }
        return new ShareSettingsDTO(
            Boolean.TRUE.equals(settings.getIsPublic()),
            Boolean.TRUE.equals(settings.getAllowComments()),
            settings.requiresPassword());
    }
}
