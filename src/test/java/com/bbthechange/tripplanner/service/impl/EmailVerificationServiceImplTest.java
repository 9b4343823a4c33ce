package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.dto.EmailVerificationStatusDTO;
import com.bbthechange.tripplanner.exception.ResourceNotFoundException;
import com.bbthechange.tripplanner.exception.ValidationException;
import com.bbthechange.tripplanner.model.EmailVerification;
import com.bbthechange.tripplanner.repository.EmailVerificationRepository;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import com.bbthechange.tripplanner.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmailVerificationService Tests")
class EmailVerificationServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    @Mock
    private EmailVerificationRepository verificationRepository;

    @Mock
    private EmailNotificationService emailNotificationService;

    private MutableClock clock;
    private EmailVerificationServiceImpl verificationService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        verificationService = new EmailVerificationServiceImpl(verificationRepository, emailNotificationService,
            clock, "https://trips.example.com");
    }

    @Test
    void requestVerification_IssuesTwentyFourHourToken() {
        // Given
        when(verificationRepository.findByEmail("carol@example.com")).thenReturn(Optional.empty());
        when(verificationRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(emailNotificationService.sendVerificationEmail(eq("carol@example.com"), anyString())).thenReturn(true);

        // When
        boolean sent = verificationService.requestVerification(" Carol@Example.com ");

        // Then
        assertThat(sent).isTrue();
        ArgumentCaptor<EmailVerification> captor = ArgumentCaptor.forClass(EmailVerification.class);
        verify(verificationRepository).save(captor.capture());
        EmailVerification saved = captor.getValue();
        assertThat(saved.getEmail()).isEqualTo("carol@example.com");
        assertThat(saved.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(saved.verificationComplete()).isFalse();
        verify(emailNotificationService).sendVerificationEmail("carol@example.com",
            "https://trips.example.com/verify-email/" + saved.getToken());
    }

    @Test
    void requestVerification_AlreadyVerifiedSendsNothing() {
        EmailVerification done = new EmailVerification("carol@example.com", "t", NOW.minus(Duration.ofDays(2)));
        done.markVerified(NOW.minus(Duration.ofDays(1)));
        when(verificationRepository.findByEmail("carol@example.com")).thenReturn(Optional.of(done));

        assertThat(verificationService.requestVerification("carol@example.com")).isFalse();
        verify(verificationRepository, never()).save(any());
        verify(emailNotificationService, never()).sendVerificationEmail(anyString(), anyString());
    }

    @Test
    void requestVerification_InvalidEmailIsRejected() {
        assertThatThrownBy(() -> verificationService.requestVerification("nope"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void verify_MarksVerifiedAndConsumesToken() {
        EmailVerification pending = new EmailVerification("carol@example.com", "tok", NOW);
        when(verificationRepository.findByToken("tok")).thenReturn(Optional.of(pending));
        when(verificationRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        clock.advance(Duration.ofHours(2));

        EmailVerificationStatusDTO status = verificationService.verify("tok");

        assertThat(status.getVerified()).isTrue();
        assertThat(status.getVerifiedAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        assertThat(pending.getToken()).isNull();
    }

    @Test
    void verify_ExpiredTokenIsRejected() {
        when(verificationRepository.findByToken("tok"))
            .thenReturn(Optional.of(new EmailVerification("carol@example.com", "tok", NOW)));
        clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> verificationService.verify("tok"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("expired");
        verify(verificationRepository, never()).save(any());
    }

    @Test
    void verify_UnknownTokenIsNotFound() {
        when(verificationRepository.findByToken("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> verificationService.verify("missing"))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void status_UnknownEmailIsUnverified() {
        when(verificationRepository.findByEmail("dave@example.com")).thenReturn(Optional.empty());

        EmailVerificationStatusDTO status = verificationService.getStatus("dave@example.com");

        assertThat(status.getVerified()).isFalse();
        assertThat(status.getVerifiedAt()).isNull();
        assertThat(verificationService.isVerified(null)).isFalse();
    }
}
