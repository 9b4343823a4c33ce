package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.ShareLink;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class ShareLinkDTO {

    private String id;
    private String url;
    private String token;
    private ShareSettingsDTO settings;
    private Long accessCount;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastAccessed;

    public static ShareLinkDTO from(ShareLink link, String url) {
        ShareLinkDTO dto = new ShareLinkDTO();
        dto.id = link.getId();
        dto.url = url;
        dto.token = link.getToken();
        dto.settings = ShareSettingsDTO.from(link.getSettings());
        dto.accessCount = link.getAccessCount();
        dto.createdAt = link.getCreatedAt();
        dto.expiresAt = link.getExpiresAt();
        dto.lastAccessed = link.getLastAccessed();
        return dto;
    }
}
