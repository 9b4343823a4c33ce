package com.bbthechange.tripplanner.repository;

import com.bbthechange.tripplanner.model.EmailVerification;

import java.util.Optional;

public interface EmailVerificationRepository {

    EmailVerification save(EmailVerification verification);

    Optional<EmailVerification> findByEmail(String email);

    Optional<EmailVerification> findByToken(String token);
}
