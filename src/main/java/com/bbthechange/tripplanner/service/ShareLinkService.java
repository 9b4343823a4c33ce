package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.CreateShareLinkRequest;
import com.bbthechange.tripplanner.dto.CreateShareLinkResponse;
import com.bbthechange.tripplanner.dto.ShareLinkDTO;
import com.bbthechange.tripplanner.dto.SharedTripView;

import java.util.List;

public interface ShareLinkService {

    CreateShareLinkResponse createShareLink(String tripId, CreateShareLinkRequest request, String userId);

    /**
     * Resolves a share token to the filtered trip view and records the access.
     * Expiry is checked before the password so an expired link never reveals whether a password was right.
     */
    SharedTripView resolveSharedTrip(String token, String password, String clientIp);

    List<ShareLinkDTO> getShareLinks(String tripId, String userId);
}
