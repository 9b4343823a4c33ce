package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.model.ShareSettings;
import com.bbthechange.tripplanner.model.TripRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SesEmailNotificationService Tests")
class SesEmailNotificationServiceTest {

    @Mock
    private SesV2Client sesClient;

    @Test
    void disabled_LogsInsteadOfSending() {
        SesEmailNotificationService service = new SesEmailNotificationService(sesClient, false, "noreply@example.com");

        boolean sent = service.sendVerificationEmail("carol@example.com", "https://trips.example.com/verify-email/t");

        assertThat(sent).isFalse();
        verifyNoInteractions(sesClient);
    }

    @Test
    void enabled_SendsEscapedInviteThroughSes() {
        // Given
        SesEmailNotificationService service = new SesEmailNotificationService(sesClient, true, "noreply@example.com");
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
            .thenReturn(SendEmailResponse.builder().messageId("msg-1").build());

        // When
        boolean sent = service.sendInviteEmail("bob@example.com", "Alice <script>", "Lisbon Getaway",
            TripRole.EDITOR, "https://trips.example.com/invite/abc", "See you there");

        // Then
        assertThat(sent).isTrue();
        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(captor.capture());
        SendEmailRequest request = captor.getValue();
        assertThat(request.fromEmailAddress()).isEqualTo("noreply@example.com");
        assertThat(request.destination().toAddresses()).containsExactly("bob@example.com");
        String html = request.content().simple().body().html().data();
        assertThat(html).contains("Alice &lt;script&gt;").contains("editor").doesNotContain("<script>");
    }

    @Test
    void sesFailure_ReportsNotSent() {
        SesEmailNotificationService service = new SesEmailNotificationService(sesClient, true, "noreply@example.com");
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
            .thenThrow(SesV2Exception.builder().message("throttled").build());

        boolean sent = service.sendShareNotificationEmail("alice@example.com", "Lisbon Getaway", "Lisbon",
            "https://trips.example.com/shared/abc", new ShareSettings(true, false, false, null));

        assertThat(sent).isFalse();
    }
}
