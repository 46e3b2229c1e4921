package com.portfoliodevs.notifier.scheduler;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates job ids of the form {@code job-<sequence>-<random>}.
 * The sequence keeps ids unique within one instance; the random part keeps them
 * unique across restarts when jobs are reloaded from a checkpoint.
 */
public class JobIdGenerator {

    private final AtomicLong sequence = new AtomicLong();

    public String nextId() {
        String random = UUID.randomUUID().toString().substring(0, 8);
        return "job-" + sequence.incrementAndGet() + "-" + random;
    }
}
