package com.portfoliodevs.notifier.scheduler;

/**
 * Checkpoint record of a pending job. The fire time is stored as epoch millis.
 */
public record PersistedJob(
        String id,
        long fireAtEpochMillis,
        JobPayload payload,
        JobState state
) {
}
