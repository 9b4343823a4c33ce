package com.bbthechange.tripplanner.service;

import com.bbthechange.tripplanner.dto.EmailVerificationStatusDTO;

public interface EmailVerificationService {

    /**
     * Issues a fresh 24 hour verification token and mails the link.
     *
     * @return whether the verification email was sent
     */
    boolean requestVerification(String email);

    EmailVerificationStatusDTO verify(String token);

    EmailVerificationStatusDTO getStatus(String email);

    boolean isVerified(String email);
}
