package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.model.ShareSettings;
import com.bbthechange.tripplanner.model.TripRole;

/**
 * Outbound transactional email. Implementations report delivery failures through the
 * return value; a failed email never fails the request that triggered it.
 */
public interface EmailNotificationService {

    boolean sendInviteEmail(String toEmail, String inviterName, String tripTitle, TripRole role,
                            String inviteUrl, String message);

    boolean sendShareNotificationEmail(String toEmail, String tripTitle, String destination,
                                       String shareUrl, ShareSettings settings);

    boolean sendVerificationEmail(String toEmail, String verificationUrl);
}
