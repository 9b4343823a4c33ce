package com.bbthechange.tripplanner.controller;

import com.bbthechange.tripplanner.dto.CreateShareLinkRequest;
import com.bbthechange.tripplanner.dto.CreateShareLinkResponse;
import com.bbthechange.tripplanner.dto.ShareLinkDTO;
import com.bbthechange.tripplanner.dto.SharedTripResponse;
import com.bbthechange.tripplanner.service.ShareLinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Sharing", description = "Public read-only share links")
public class ShareController extends BaseController {

    private final ShareLinkService shareLinkService;

    @Autowired
    public ShareController(ShareLinkService shareLinkService) {
        this.shareLinkService = shareLinkService;
    }

    @PostMapping("/trips/{tripId}/share")
    @Operation(summary = "Create a share link", description = "Requires manage_settings.")
    public ResponseEntity<CreateShareLinkResponse> createShareLink(@PathVariable String tripId,
                                                                   @Valid @RequestBody CreateShareLinkRequest request,
                                                                   HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(shareLinkService.createShareLink(tripId, request, userId));
    }

    @GetMapping("/trips/{tripId}/share-links")
    @Operation(summary = "List share links of a trip", description = "Requires manage_settings.")
    public ResponseEntity<List<ShareLinkDTO>> getShareLinks(@PathVariable String tripId,
                                                            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(shareLinkService.getShareLinks(tripId, userId));
    }

    @GetMapping("/shared/{token}")
    @Operation(summary = "Open a shared trip",
               description = "404 unknown link, 410 expired, 401 missing or wrong password, 429 too many wrong passwords.")
    public ResponseEntity<SharedTripResponse> getSharedTrip(
            @PathVariable String token,
            @Parameter(description = "Password for protected links") @RequestParam(required = false) String password,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(new SharedTripResponse("Shared trip retrieved successfully",
            shareLinkService.resolveSharedTrip(token, password, clientIp(httpRequest))));
    }
}
