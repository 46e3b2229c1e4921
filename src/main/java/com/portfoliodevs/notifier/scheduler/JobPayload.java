package com.portfoliodevs.notifier.scheduler;

import com.portfoliodevs.notifier.model.NotificationKind;

import java.util.Map;

/**
 * Everything needed to deliver a job's notification when it fires.
 *
 * @param recipient email address or phone number of the party being notified
 * @param kind template kind passed to the notification sender
 * @param description human-readable name shown when listing pending jobs
 * @param correlationId id shared by jobs created from the same request
 * @param context template values handed to the sender as-is
 */
public record JobPayload(
        String recipient,
        NotificationKind kind,
        String description,
        String correlationId,
        Map<String, String> context
) {
    public JobPayload {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
