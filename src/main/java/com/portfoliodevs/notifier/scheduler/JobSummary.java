package com.portfoliodevs.notifier.scheduler;

import java.time.Instant;

/**
 * Read-only view of a pending job.
 */
public record JobSummary(
        String id,
        String description,
        String correlationId,
        String recipient,
        Instant nextFireTime
) {
}
