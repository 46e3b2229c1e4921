package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.model.NotificationKind;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the channel from the recipient: phone numbers ({@code +...} or
 * {@code whatsapp:...}) go to WhatsApp, everything else is treated as an email address.
 */
@Service
@Primary
public class ChannelRoutingNotificationSender implements NotificationSender {

    private static final Pattern PHONE_NUMBER = Pattern.compile("^(whatsapp:)?\\+[0-9]{6,15}$");

    private final EmailNotificationSender emailSender;
    private final WhatsAppNotificationSender whatsAppSender;

    public ChannelRoutingNotificationSender(EmailNotificationSender emailSender,
                                            WhatsAppNotificationSender whatsAppSender) {
        this.emailSender = emailSender;
        this.whatsAppSender = whatsAppSender;
    }

    @Override
    public SendOutcome send(String recipient, NotificationKind kind, Map<String, String> context) {
        if (isPhoneNumber(recipient)) {
            return whatsAppSender.send(recipient, kind, context);
        }
        return emailSender.send(recipient, kind, context);
    }

    static boolean isPhoneNumber(String recipient) {
        return recipient != null && PHONE_NUMBER.matcher(recipient.trim()).matches();
    }
}
