package com.portfoliodevs.notifier.scheduler;

/**
 * Lifecycle state of a scheduled job. FIRED and CANCELLED are terminal.
 */
public enum JobState {
    PENDING,
    FIRED,
    CANCELLED
}
