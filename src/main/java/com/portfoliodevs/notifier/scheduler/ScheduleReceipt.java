package com.portfoliodevs.notifier.scheduler;

import java.time.Instant;

/**
 * Returned by {@link DelayedJobScheduler#schedule}.
 *
 * @param jobId id to list or cancel the job by
 * @param fireAt effective fire time after clamping
 * @param clamped true if the requested fire time had already passed
 */
public record ScheduleReceipt(String jobId, Instant fireAt, boolean clamped) {
}
