package com.portfoliodevs.notifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import com.portfoliodevs.notifier.scheduler.FileJobStore;
import com.portfoliodevs.notifier.scheduler.JobIdGenerator;
import com.portfoliodevs.notifier.scheduler.JobStore;
import com.portfoliodevs.notifier.scheduler.NoopJobStore;
import com.portfoliodevs.notifier.service.NotificationSender;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the reminder scheduler. The scheduler is started with the context and
 * closed on shutdown, leaving pending jobs in the checkpoint when one is configured.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobIdGenerator jobIdGenerator() {
        return new JobIdGenerator();
    }

    @Bean
    public JobStore jobStore(SchedulerProperties properties, ObjectMapper objectMapper) {
        SchedulerProperties.Persistence persistence = properties.getPersistence();
        if (persistence.isEnabled()) {
            logger.info("Reminder checkpoint enabled at {}", persistence.getPath());
            return new FileJobStore(Path.of(persistence.getPath()), objectMapper);
        }
        logger.info("Reminder checkpoint disabled, pending reminders are lost on restart");
        return new NoopJobStore();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public DelayedJobScheduler delayedJobScheduler(NotificationSender notificationSender,
                                                   JobStore jobStore,
                                                   Clock clock,
                                                   MeterRegistry meterRegistry,
                                                   JobIdGenerator jobIdGenerator,
                                                   SchedulerProperties properties) {
        return new DelayedJobScheduler(notificationSender, jobStore, clock, meterRegistry,
                jobIdGenerator, properties);
    }
}
