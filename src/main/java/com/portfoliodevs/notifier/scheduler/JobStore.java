package com.portfoliodevs.notifier.scheduler;

import java.util.List;

/**
 * Checkpoint of the pending-job set, keyed by job id.
 * <p>
 * Calls are made while the scheduler holds its lock, so implementations see
 * changes in the same order the scheduler applies them.
 */
public interface JobStore {

    /**
     * Record a newly scheduled job.
     *
     * @throws com.portfoliodevs.notifier.exception.JobStoreException if the checkpoint cannot be written
     */
    void save(ScheduledJob job);

    /**
     * Forget a job that fired or was cancelled. Unknown ids are ignored.
     *
     * @throws com.portfoliodevs.notifier.exception.JobStoreException if the checkpoint cannot be written
     */
    void remove(String jobId);

    /**
     * Jobs that were still pending when the checkpoint was last written.
     */
    List<PersistedJob> loadPending();
}
