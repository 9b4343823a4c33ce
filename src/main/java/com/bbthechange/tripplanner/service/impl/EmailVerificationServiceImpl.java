package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.EmailVerificationStatusDTO;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.EmailVerification;
import com.bbthechange.tripplanner.repository.EmailVerificationRepository;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.service.EmailVerificationService;
import com.bbthechange.tripplanner.util.EmailAddresses;
import com.bbthechange.tripplanner.util.SecureTokenGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
public class EmailVerificationServiceImpl implements EmailVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(EmailVerificationServiceImpl.class);

    private final EmailVerificationRepository verificationRepository;
    private final EmailNotificationService emailNotificationService;
    private final Clock clock;
    private final String baseUrl;

    @Autowired
    public EmailVerificationServiceImpl(EmailVerificationRepository verificationRepository,
                                        EmailNotificationService emailNotificationService,
                                        Clock clock,
                                        @Value("${app.base-url:http://localhost:3000}") String baseUrl) {
        this.verificationRepository = verificationRepository;
        this.emailNotificationService = emailNotificationService;
        this.clock = clock;
        this.baseUrl = baseUrl;
    }

    @Override
    public boolean requestVerification(String email) {
        String normalized = EmailAddresses.requireValid(email);
        Optional<EmailVerification> existing = verificationRepository.findByEmail(normalized);
        if (existing.isPresent() && existing.get().verificationComplete()) {
            logger.debug("Email {} already verified, nothing to send", normalized);
            return false;
        }

        EmailVerification verification = new EmailVerification(normalized, SecureTokenGenerator.generate(), clock.instant());
        verificationRepository.save(verification);
        logger.info("Issued email verification for {} expiring {}", normalized, verification.getExpiresAt());

        return emailNotificationService.sendVerificationEmail(normalized,
            baseUrl + "/verify-email/" + verification.getToken());
    }

    @Override
    public EmailVerificationStatusDTO verify(String token) {
        EmailVerification verification = verificationRepository.findByToken(token)
            .orElseThrow(() -> new ResourceNotFoundException("Verification link is invalid or was already used"));

        Instant now = clock.instant();
        if (verification.isExpiredAt(now)) {
            throw new ValidationException("Verification link has expired. Please request a new one.");
        }
        verification.markVerified(now);
        verificationRepository.save(verification);
        logger.info("Email {} verified", verification.getEmail());

        return toStatus(verification);
    }

    @Override
    public EmailVerificationStatusDTO getStatus(String email) {
        String normalized = EmailAddresses.requireValid(email);
        return verificationRepository.findByEmail(normalized)
            .map(EmailVerificationServiceImpl::toStatus)
            .orElseGet(() -> new EmailVerificationStatusDTO(normalized, false, null));
    }

    @Override
    public boolean isVerified(String email) {
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null) {
            return false;
        }
        return verificationRepository.findByEmail(normalized)
            .map(EmailVerification::verificationComplete)
            .orElse(false);
    }

    private static EmailVerificationStatusDTO toStatus(EmailVerification verification) {
        return new EmailVerificationStatusDTO(verification.getEmail(), verification.verificationComplete(),
            verification.getVerifiedAt());
    }
}
