package com.portfoliodevs.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Delay applied to jobs whose requested fire time has already passed.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration clampDelay = Duration.ofSeconds(10);

    /**
     * Upper bound on a single send; a slower send is recorded as a timed-out attempt.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration sendTimeout = Duration.ofSeconds(30);

    private int workerThreads = 4;

    private int defaultLeadMinutes = 30;

    /**
     * Zone used to interpret the local session date-times of reminder requests.
     */
    private ZoneId timeZone = ZoneId.of("UTC");

    private final Persistence persistence = new Persistence();

    public Duration getClampDelay() {
        return clampDelay;
    }

    public void setClampDelay(Duration clampDelay) {
        this.clampDelay = clampDelay;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
        this.sendTimeout = sendTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getDefaultLeadMinutes() {
        return defaultLeadMinutes;
    }

    public void setDefaultLeadMinutes(int defaultLeadMinutes) {
        this.defaultLeadMinutes = defaultLeadMinutes;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(ZoneId timeZone) {
        this.timeZone = timeZone;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public static class Persistence {

        private boolean enabled = false;

        private String path = "data/pending-reminders.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
