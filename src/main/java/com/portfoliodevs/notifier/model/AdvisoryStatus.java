package com.portfoliodevs.notifier.model;

/**
 * Lifecycle status of an advisory session as reported by the upstream platform.
 */
public enum AdvisoryStatus {
    /** Session requested, awaiting the programmer's decision. */
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED
}
