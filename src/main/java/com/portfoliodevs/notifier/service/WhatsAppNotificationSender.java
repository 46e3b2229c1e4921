package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.NotificationProperties;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Sends WhatsApp messages through the Twilio Messages API.
 * <p>
 * Without Twilio credentials the message is logged and reported as a simulated
 * success, so local environments work without an account.
 */
@Service
public class WhatsAppNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(WhatsAppNotificationSender.class);

    static final String WHATSAPP_PREFIX = "whatsapp:";
    static final String SIMULATED = "simulated";

    private final NotificationProperties.WhatsApp settings;
    private final NotificationTextGenerator textGenerator;
    private final MeterRegistry meterRegistry;

    public WhatsAppNotificationSender(NotificationProperties properties,
                                      NotificationTextGenerator textGenerator,
                                      MeterRegistry meterRegistry) {
        this.settings = properties.getWhatsapp();
        this.textGenerator = textGenerator;
        this.meterRegistry = meterRegistry;

        if (settings.isConfigured()) {
            Twilio.init(settings.getAccountSid(), settings.getAuthToken());
            logger.info("WhatsApp sender initialized with Twilio, from {}", settings.getFromNumber());
        } else {
            logger.info("WhatsApp sender initialized in SIMULATED mode (no Twilio credentials)");
        }
    }

    @Override
    public SendOutcome send(String recipient, NotificationKind kind, Map<String, String> context) {
        String to = toWhatsAppAddress(recipient);
        String body = textGenerator.getPlainBody(kind, context);

        if (!settings.isConfigured()) {
            logger.info("[WhatsApp Simulated] {} message to {}: {}", kind, to, abbreviate(body));
            meterRegistry.counter("whatsapp_notification_total", "status", SIMULATED, "kind", kind.name()).increment();
            return SendOutcome.success(SIMULATED);
        }

        try {
            String sid = createMessage(to, body);
            logger.info("WhatsApp {} message sent to {} with SID: {}", kind, to, sid);
            meterRegistry.counter("whatsapp_notification_total", "status", "success", "kind", kind.name()).increment();
            return SendOutcome.success(sid);
        } catch (ApiException e) {
            logger.error("Twilio rejected WhatsApp message to {}: {} (code: {})", to, e.getMessage(), e.getCode());
            meterRegistry.counter("whatsapp_notification_total", "status", "rejected", "kind", kind.name()).increment();
            return SendOutcome.failure("twilio error " + e.getCode() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error sending WhatsApp message to {}: {}", to, e.getMessage(), e);
            meterRegistry.counter("whatsapp_notification_total", "status", "error", "kind", kind.name()).increment();
            return SendOutcome.failure("whatsapp send failed: " + e.getMessage());
        }
    }

    /**
     * Create the message through Twilio and return its SID.
     */
    String createMessage(String to, String body) {
        Message message = Message.creator(
                        new PhoneNumber(to),
                        new PhoneNumber(settings.getFromNumber()),
                        body)
                .create();
        return message.getSid();
    }

    static String toWhatsAppAddress(String recipient) {
        String trimmed = recipient.trim();
        return trimmed.startsWith(WHATSAPP_PREFIX) ? trimmed : WHATSAPP_PREFIX + trimmed;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
