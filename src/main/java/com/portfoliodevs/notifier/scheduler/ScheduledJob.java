package com.portfoliodevs.notifier.scheduler;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A single one-shot timed job owned by {@link DelayedJobScheduler}.
 * <p>
 * State is only read and written while the scheduler's lock is held, so the
 * PENDING -> FIRED and PENDING -> CANCELLED transitions are decided exactly once.
 */
public final class ScheduledJob {

    /** Earliest fire time first, creation order breaks ties. */
    static final Comparator<ScheduledJob> FIRE_ORDER = Comparator
            .comparing(ScheduledJob::getFireAt)
            .thenComparingLong(ScheduledJob::getSequence);

    private final String id;
    private final long sequence;
    private final Instant fireAt;
    private final JobPayload payload;
    private JobState state = JobState.PENDING;

    ScheduledJob(String id, long sequence, Instant fireAt, JobPayload payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.sequence = sequence;
        this.fireAt = Objects.requireNonNull(fireAt, "fireAt");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String getId() {
        return id;
    }

    long getSequence() {
        return sequence;
    }

    public Instant getFireAt() {
        return fireAt;
    }

    public JobPayload getPayload() {
        return payload;
    }

    public JobState getState() {
        return state;
    }

    void markFired() {
        transition(JobState.FIRED);
    }

    void markCancelled() {
        transition(JobState.CANCELLED);
    }

    private void transition(JobState target) {
        if (state != JobState.PENDING) {
            throw new IllegalStateException("Job " + id + " is already " + state + ", cannot move to " + target);
        }
        state = target;
    }

    JobSummary toSummary() {
        return new JobSummary(id, payload.description(), payload.correlationId(), payload.recipient(), fireAt);
    }

    PersistedJob toPersisted() {
        return new PersistedJob(id, fireAt.toEpochMilli(), payload, state);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id='" + id + "', fireAt=" + fireAt + ", state=" + state + "}";
    }
}
