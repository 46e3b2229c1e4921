package com.portfoliodevs.notifier.scheduler;

import com.portfoliodevs.notifier.config.SchedulerProperties;
import com.portfoliodevs.notifier.exception.JobStoreException;
import com.portfoliodevs.notifier.exception.ValidationException;
import com.portfoliodevs.notifier.service.NotificationSender;
import com.portfoliodevs.notifier.service.SendOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process scheduler for one-shot delayed notification jobs.
 * <p>
 * A single timing loop thread sleeps until the earliest pending fire time (Armed)
 * or until signalled when nothing is pending (Idle). On wake it moves every due job
 * to FIRED and queues it on a worker pool. A worker picks the job up, calls the
 * {@link NotificationSender} once and waits at most the send timeout for it, so a
 * queued job is always attempted no matter how long it waited for a free worker.
 * Delivery failures are logged and counted, never retried.
 * <p>
 * The pending set is guarded by one lock. Firing and cancelling both decide the
 * job's terminal state under that lock, so a job is either fired or cancelled,
 * never both, and never fired twice. Jobs never fire before their fire time;
 * a requested fire time that has already passed is clamped to now plus the
 * configured clamp delay.
 */
public class DelayedJobScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DelayedJobScheduler.class);

    // Long waits are re-evaluated so wall-clock adjustments are picked up
    private static final Duration MAX_ARMED_WAIT = Duration.ofHours(1);

    private final NotificationSender sender;
    private final JobStore jobStore;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final JobIdGenerator idGenerator;
    private final Duration clampDelay;
    private final Duration sendTimeout;
    private final ExecutorService workers;
    private final ExecutorService sends;
    private final Thread timingThread;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Map<String, ScheduledJob> pending = new HashMap<>();
    private final NavigableSet<ScheduledJob> timeline = new TreeSet<>(ScheduledJob.FIRE_ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running = true;
    private volatile boolean restored = false;

    public DelayedJobScheduler(NotificationSender sender,
                               JobStore jobStore,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               JobIdGenerator idGenerator,
                               SchedulerProperties properties) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.clampDelay = requirePositive(properties.getClampDelay(), "clampDelay");
        this.sendTimeout = requirePositive(properties.getSendTimeout(), "sendTimeout");
        if (properties.getWorkerThreads() < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        this.workers = Executors.newFixedThreadPool(properties.getWorkerThreads(),
                new DaemonThreadFactory("reminder-worker-"));
        // A timed-out send keeps its thread until the sender returns; it must not hold a worker
        this.sends = Executors.newCachedThreadPool(new DaemonThreadFactory("reminder-send-"));
        this.timingThread = new DaemonThreadFactory("reminder-timer-").newThread(this::runTimingLoop);

        Gauge.builder("reminder_pending_jobs", this, DelayedJobScheduler::pendingCount)
                .description("Reminder jobs waiting to fire")
                .register(meterRegistry);
    }

    /**
     * Reload checkpointed jobs and start the timing loop. Calling it again has no effect.
     *
     * @throws JobStoreException if the checkpoint cannot be read
     */
    public void start() {
        if (!running) {
            throw new IllegalStateException("Scheduler has been closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        restorePending();
        restored = true;
        timingThread.start();
        logger.info("Reminder scheduler started: clampDelay={}, sendTimeout={}", clampDelay, sendTimeout);
    }

    /**
     * Add a job that fires at {@code fireAt}, or shortly after now if that time has passed.
     * Returns immediately; the send happens later on a worker thread.
     *
     * @throws ValidationException if the payload has no recipient or kind
     * @throws JobStoreException if the job cannot be checkpointed
     * @throws IllegalStateException if the scheduler is not started or already closed
     */
    public ScheduleReceipt schedule(Instant fireAt, JobPayload payload) {
        Objects.requireNonNull(fireAt, "fireAt");
        validate(payload);
        if (!running) {
            throw new IllegalStateException("Scheduler has been closed");
        }
        if (!restored) {
            // The checkpoint has not been restored yet; saving now would overwrite it
            throw new IllegalStateException("Scheduler has not been started");
        }

        Instant now = clock.instant();
        boolean clamped = !fireAt.isAfter(now);
        Instant effectiveFireAt = clamped ? now.plus(clampDelay) : fireAt;

        ScheduledJob job = new ScheduledJob(idGenerator.nextId(), sequence.incrementAndGet(), effectiveFireAt, payload);
        lock.lock();
        try {
            jobStore.save(job);
            pending.put(job.getId(), job);
            timeline.add(job);
            if (timeline.first() == job) {
                wakeUp.signal();
            }
        } finally {
            lock.unlock();
        }

        if (clamped) {
            logger.warn("Requested fire time {} for job {} ({}) already passed, firing at {} instead",
                    fireAt, job.getId(), payload.description(), effectiveFireAt);
        } else {
            logger.info("Scheduled job {} ({}) for {}", job.getId(), payload.description(), effectiveFireAt);
        }
        meterRegistry.counter("reminder_scheduled_total", "clamped", String.valueOf(clamped)).increment();
        return new ScheduleReceipt(job.getId(), effectiveFireAt, clamped);
    }

    /**
     * Cancel a pending job.
     *
     * @return true if the job was pending and is now cancelled; false if it is unknown,
     *         already fired or already cancelled
     */
    public boolean cancel(String jobId) {
        if (jobId == null) {
            return false;
        }
        ScheduledJob job;
        lock.lock();
        try {
            job = pending.remove(jobId);
            if (job == null) {
                logger.debug("Cancel ignored for unknown or finished job {}", jobId);
                return false;
            }
            timeline.remove(job);
            job.markCancelled();
            forget(job);
            wakeUp.signal();
        } finally {
            lock.unlock();
        }

        logger.info("Cancelled job {} ({})", jobId, job.getPayload().description());
        meterRegistry.counter("reminder_cancelled_total").increment();
        return true;
    }

    /**
     * Pending jobs ordered by fire time, then by creation order.
     */
    public List<JobSummary> listPending() {
        lock.lock();
        try {
            return timeline.stream().map(ScheduledJob::toSummary).toList();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the timing loop and wait up to the send timeout for in-flight sends.
     * Pending jobs stay in the checkpoint for the next start.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        lock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }

        if (started.get()) {
            timingThread.interrupt();
            try {
                timingThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        workers.shutdown();
        sends.shutdown();
        try {
            if (!workers.awaitTermination(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Reminder workers did not finish within {}, interrupting", sendTimeout);
                workers.shutdownNow();
            }
            if (!sends.awaitTermination(1, TimeUnit.SECONDS)) {
                sends.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            sends.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Reminder scheduler stopped with {} job(s) still pending", pendingCount());
    }

    private void runTimingLoop() {
        logger.debug("Reminder timing loop running");
        while (running) {
            List<ScheduledJob> due;
            lock.lock();
            try {
                due = awaitDueJobs();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                lock.unlock();
            }
            for (ScheduledJob job : due) {
                dispatch(job);
            }
        }
        logger.debug("Reminder timing loop exited");
    }

    // Lock must be held. Returns once at least one job is due, or empty when stopping.
    private List<ScheduledJob> awaitDueJobs() throws InterruptedException {
        while (running) {
            if (timeline.isEmpty()) {
                wakeUp.await();
                continue;
            }
            Instant now = clock.instant();
            Duration wait = Duration.between(now, timeline.first().getFireAt());
            if (wait.isZero() || wait.isNegative()) {
                return drainDue(now);
            }
            if (wait.compareTo(MAX_ARMED_WAIT) > 0) {
                wait = MAX_ARMED_WAIT;
            }
            wakeUp.awaitNanos(wait.toNanos());
        }
        return List.of();
    }

    // Lock must be held.
    private List<ScheduledJob> drainDue(Instant now) {
        List<ScheduledJob> due = new ArrayList<>();
        while (!timeline.isEmpty() && !timeline.first().getFireAt().isAfter(now)) {
            ScheduledJob job = timeline.pollFirst();
            pending.remove(job.getId());
            job.markFired();
            forget(job);
            due.add(job);
        }
        return due;
    }

    // Lock must be held. A failed removal may make the job fire again after a restart.
    private void forget(ScheduledJob job) {
        try {
            jobStore.remove(job.getId());
        } catch (JobStoreException e) {
            logger.error("Failed to remove {} job {} from checkpoint: {}",
                    job.getState(), job.getId(), e.getMessage(), e);
        }
    }

    private void dispatch(ScheduledJob job) {
        try {
            workers.execute(() -> deliver(job));
        } catch (RejectedExecutionException e) {
            logger.error("Job {} fired but could not be dispatched, workers are shut down", job.getId(), e);
            meterRegistry.counter("reminder_delivery_total", "status", "rejected").increment();
        }
    }

    // Runs on a worker. The send timeout starts here, not when the job was queued.
    private void deliver(ScheduledJob job) {
        JobPayload payload = job.getPayload();
        logger.info("Firing job {} ({}) to {}", job.getId(), payload.description(), payload.recipient());
        Future<SendOutcome> send;
        try {
            send = sends.submit(() -> sender.send(payload.recipient(), payload.kind(), payload.context()));
        } catch (RejectedExecutionException e) {
            logger.error("Job {} could not be sent, scheduler is shutting down", job.getId(), e);
            meterRegistry.counter("reminder_delivery_total", "status", "rejected").increment();
            return;
        }
        try {
            recordOutcome(job, send.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS), null);
        } catch (TimeoutException e) {
            send.cancel(true);
            recordOutcome(job, null, e);
        } catch (ExecutionException e) {
            recordOutcome(job, null, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            send.cancel(true);
            Thread.currentThread().interrupt();
            recordOutcome(job, null, e);
        }
    }

    private void recordOutcome(ScheduledJob job, SendOutcome outcome, Throwable failure) {
        String recipient = job.getPayload().recipient();
        if (failure instanceof TimeoutException) {
            logger.warn("Delivery of job {} to {} timed out after {}", job.getId(), recipient, sendTimeout);
            meterRegistry.counter("reminder_delivery_total", "status", "timeout").increment();
            return;
        }
        if (failure != null) {
            logger.error("Delivery of job {} to {} threw: {}", job.getId(), recipient, failure.getMessage(), failure);
            meterRegistry.counter("reminder_delivery_total", "status", "error").increment();
            return;
        }
        if (outcome != null && outcome.isSuccess()) {
            logger.info("Delivered job {} to {}: {}", job.getId(), recipient, outcome.getDetail());
            meterRegistry.counter("reminder_delivery_total", "status", "success").increment();
        } else {
            String reason = outcome != null ? outcome.getDetail() : "sender returned no outcome";
            logger.warn("Delivery of job {} to {} failed: {}", job.getId(), recipient, reason);
            meterRegistry.counter("reminder_delivery_total", "status", "failure").increment();
        }
    }

    private void restorePending() {
        List<PersistedJob> checkpointed = jobStore.loadPending();
        if (checkpointed.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        int overdue = 0;
        lock.lock();
        try {
            for (PersistedJob persisted : checkpointed) {
                Instant fireAt = Instant.ofEpochMilli(persisted.fireAtEpochMillis());
                if (!fireAt.isAfter(now)) {
                    fireAt = now.plus(clampDelay);
                    overdue++;
                }
                ScheduledJob job = new ScheduledJob(persisted.id(), sequence.incrementAndGet(), fireAt, persisted.payload());
                pending.put(job.getId(), job);
                timeline.add(job);
            }
        } finally {
            lock.unlock();
        }
        if (overdue > 0) {
            logger.warn("{} checkpointed job(s) were overdue and will fire at now + {}", overdue, clampDelay);
        }
        logger.info("Restored {} pending job(s) from checkpoint", checkpointed.size());
    }

    private static void validate(JobPayload payload) {
        if (payload == null) {
            throw new ValidationException("Job payload is required");
        }
        if (payload.recipient() == null || payload.recipient().isBlank()) {
            throw new ValidationException("Job recipient is required");
        }
        if (payload.kind() == null) {
            throw new ValidationException("Job notification kind is required");
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }
}
