package com.portfoliodevs.notifier.scheduler;

import java.util.List;

/**
 * Keeps nothing. Pending reminders live only in memory and are lost on restart.
 */
public final class NoopJobStore implements JobStore {

    @Override
    public void save(ScheduledJob job) {
    }

    @Override
    public void remove(String jobId) {
    }

    @Override
    public List<PersistedJob> loadPending() {
        return List.of();
    }
}
