package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.NotificationProperties;
import com.portfoliodevs.notifier.model.NotificationKind;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Sends HTML email through the Brevo transactional email API.
 * <p>
 * Connect and read timeouts come from {@code notifications.email.*}; see
 * {@link com.portfoliodevs.notifier.config.HttpClientConfig}.
 */
@Service
public class EmailNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(EmailNotificationSender.class);

    private final RestTemplate restTemplate;
    private final NotificationProperties.Email settings;
    private final NotificationTextGenerator textGenerator;
    private final MeterRegistry meterRegistry;

    public EmailNotificationSender(@Qualifier("emailRestTemplate") RestTemplate restTemplate,
                                   NotificationProperties properties,
                                   NotificationTextGenerator textGenerator,
                                   MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.settings = properties.getEmail();
        this.textGenerator = textGenerator;
        this.meterRegistry = meterRegistry;

        if (settings.isConfigured()) {
            logger.info("Email sender initialized: from {} <{}>", settings.getFromName(), settings.getFromAddress());
        } else {
            logger.warn("Email sender initialized WITHOUT an API key - emails will fail until notifications.email.api-key is set");
        }
    }

    @Override
    public SendOutcome send(String recipient, NotificationKind kind, Map<String, String> context) {
        if (!settings.isConfigured()) {
            logger.error("Cannot send {} email to {}: email provider not configured", kind, recipient);
            meterRegistry.counter("email_notification_total", "status", "not_configured", "kind", kind.name()).increment();
            return SendOutcome.failure("email provider not configured");
        }

        String subject = textGenerator.getSubject(kind, context);
        Map<String, Object> body = Map.of(
                "sender", Map.of("name", settings.getFromName(), "email", settings.getFromAddress()),
                "to", List.of(Map.of("email", recipient)),
                "subject", subject,
                "htmlContent", textGenerator.getHtmlBody(kind, context));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("api-key", settings.getApiKey());

        try {
            ResponseEntity<BrevoResponse> response = restTemplate.postForEntity(
                    settings.getApiUrl(), new HttpEntity<>(body, headers), BrevoResponse.class);

            String messageId = response.getBody() != null ? response.getBody().messageId() : null;
            logger.info("Email '{}' sent to {} with messageId: {}", subject, recipient, messageId);
            meterRegistry.counter("email_notification_total", "status", "success", "kind", kind.name()).increment();
            return SendOutcome.success(messageId != null ? messageId : "accepted");

        } catch (HttpStatusCodeException e) {
            logger.error("Email provider rejected message to {}: {} {}",
                    recipient, e.getStatusCode(), e.getResponseBodyAsString());
            meterRegistry.counter("email_notification_total", "status", "rejected", "kind", kind.name()).increment();
            return SendOutcome.failure("email provider returned " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            logger.error("Email provider unreachable while sending to {}: {}", recipient, e.getMessage());
            meterRegistry.counter("email_notification_total", "status", "unreachable", "kind", kind.name()).increment();
            return SendOutcome.failure("email provider unreachable: " + e.getMessage());
        } catch (RestClientException e) {
            logger.error("Unexpected error sending email to {}: {}", recipient, e.getMessage(), e);
            meterRegistry.counter("email_notification_total", "status", "error", "kind", kind.name()).increment();
            return SendOutcome.failure("email send failed: " + e.getMessage());
        }
    }

    public record BrevoResponse(String messageId) {
    }
}
