package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.model.NotificationKind;

import java.util.Map;

/**
 * Delivers a single notification to a single recipient.
 * Implementations are stateless and must not block indefinitely.
 */
public interface NotificationSender {

    /**
     * Send one notification.
     *
     * @param recipient email address or phone number, depending on the channel
     * @param kind template kind used to render subject and body
     * @param context template values, e.g. {@code session_id}, {@code date}, {@code time}
     * @return the outcome of the single delivery attempt
     */
    SendOutcome send(String recipient, NotificationKind kind, Map<String, String> context);
}
