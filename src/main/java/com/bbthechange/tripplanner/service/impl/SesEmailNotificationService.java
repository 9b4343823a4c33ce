package com.bbthechange.tripplanner.service.impl;

import com.bbthechange.tripplanner.model.ShareSettings;
import com.bbthechange.tripplanner.model.TripRole;
import com.bbthechange.tripplanner.service.EmailNotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

/**
 * Sends notification email through SES. With tripplanner.email.enabled=false nothing leaves the
 * process and the message is only logged.
 */
@Service
public class SesEmailNotificationService implements EmailNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(SesEmailNotificationService.class);

    private final SesV2Client sesClient;
    private final boolean enabled;
    private final String fromAddress;

    public SesEmailNotificationService(SesV2Client sesClient,
                                       @Value("${tripplanner.email.enabled:false}") boolean enabled,
                                       @Value("${tripplanner.email.from:noreply@tripplanner.app}") String fromAddress) {
        this.sesClient = sesClient;
        this.enabled = enabled;
        this.fromAddress = fromAddress;

        logger.info("Email service initialized: {}", enabled ? "sending from " + fromAddress : "disabled (log only)");
    }

    @Override
    public boolean sendInviteEmail(String toEmail, String inviterName, String tripTitle, TripRole role,
                                   String inviteUrl, String message) {
        String subject = "You're invited to collaborate on " + tripTitle;
        StringBuilder html = new StringBuilder()
            .append("<h2>").append(escape(inviterName)).append(" invited you to plan a trip</h2>")
            .append("<p><strong>").append(escape(tripTitle)).append("</strong> as ")
            .append(escape(role.getValue())).append("</p>");
        if (message != null && !message.isBlank()) {
            html.append("<blockquote>").append(escape(message)).append("</blockquote>");
        }
        html.append("<p><a href='").append(escape(inviteUrl)).append("'>Open invitation</a></p>");

        String text = inviterName + " invited you to collaborate on " + tripTitle + " as " + role.getValue()
            + ".\n" + (message == null ? "" : message + "\n") + inviteUrl;
        return send(toEmail, subject, html.toString(), text);
    }

    @Override
    public boolean sendShareNotificationEmail(String toEmail, String tripTitle, String destination,
                                              String shareUrl, ShareSettings settings) {
        String subject = "Your trip " + tripTitle + " is ready to share";
        boolean protectedLink = settings != null && settings.requiresPassword();
        String html = "<h2>Share link for " + escape(tripTitle) + "</h2>"
            + "<p>" + escape(destination == null ? "" : destination) + "</p>"
            + "<p><a href='" + escape(shareUrl) + "'>" + escape(shareUrl) + "</a></p>"
            + (protectedLink ? "<p>Viewers will need the password you set.</p>" : "");
        String text = "Share link for " + tripTitle + ": " + shareUrl
            + (protectedLink ? "\nViewers will need the password you set." : "");
        return send(toEmail, subject, html, text);
    }

    @Override
    public boolean sendVerificationEmail(String toEmail, String verificationUrl) {
        String subject = "Verify your email address";
        String html = "<p>Confirm your address to receive trip invitations.</p>"
            + "<p><a href='" + escape(verificationUrl) + "'>Verify email</a></p>"
            + "<p>This link expires in 24 hours.</p>";
        String text = "Confirm your address to receive trip invitations: " + verificationUrl
            + "\nThis link expires in 24 hours.";
        return send(toEmail, subject, html, text);
    }

    private boolean send(String toEmail, String subject, String html, String text) {
        if (!enabled) {
            logger.info("[Email disabled] Would send '{}' to {}", subject, toEmail);
            return false;
        }
        try {
            SendEmailRequest request = SendEmailRequest.builder()
                .fromEmailAddress(fromAddress)
                .destination(Destination.builder().toAddresses(toEmail).build())
                .content(EmailContent.builder()
                    .simple(Message.builder()
                        .subject(utf8(subject))
                        .body(Body.builder().html(utf8(html)).text(utf8(text)).build())
                        .build())
                    .build())
                .build();

            SendEmailResponse response = sesClient.sendEmail(request);
            logger.info("Email '{}' sent to {} with messageId: {}", subject, toEmail, response.messageId());
            return true;
        } catch (SesV2Exception e) {
            logger.error("Failed to send email to {}: {}", toEmail,
                e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage(), e);
            return false;
        }
    }

    private static Content utf8(String data) {
        return Content.builder().data(data).charset("UTF-8").build();
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value == null ? "" : value);
    }
}
