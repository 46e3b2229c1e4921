package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.SchedulerProperties;
import com.portfoliodevs.notifier.dto.ReminderScheduleResponse;
import com.portfoliodevs.notifier.dto.ScheduleReminderRequest;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import com.portfoliodevs.notifier.scheduler.JobIdGenerator;
import com.portfoliodevs.notifier.scheduler.NoopJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * ReminderService wired to a real, started scheduler. Reminders whose time has
 * passed are clamped to a short delay so the sends happen within the test.
 */
class ReminderServiceSchedulingTest {

    private final List<String> sentTo = new CopyOnWriteArrayList<>();

    private DelayedJobScheduler scheduler;
    private ReminderService reminderService;
    private SchedulerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setClampDelay(Duration.ofMillis(500));
        properties.setSendTimeout(Duration.ofSeconds(2));

        NotificationSender sender = (String recipient, NotificationKind kind, Map<String, String> context) -> {
            sentTo.add(recipient);
            return SendOutcome.success("ok");
        };
        scheduler = new DelayedJobScheduler(sender, new NoopJobStore(), Clock.systemUTC(),
                new SimpleMeterRegistry(), new JobIdGenerator(), properties);
        scheduler.start();
        reminderService = new ReminderService(scheduler, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void scheduleReminder_LeadLongerThanTimeToSession_BothRemindersSentAfterClampDelay() {
        // Given: a session ten minutes away with a thirty minute lead
        LocalDateTime sessionStart = LocalDateTime.now(properties.getTimeZone()).plusMinutes(10);
        ScheduleReminderRequest request = new ScheduleReminderRequest(
                "42", sessionStart, "ana@devs.com", "+51987654321", 30, "Ana");

        // When
        ReminderScheduleResponse response = reminderService.scheduleReminder(request);

        // Then
        assertThat(response.isClamped()).isTrue();
        assertThat(response.getJobIds()).hasSize(2);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> sentTo.contains("ana@devs.com") && sentTo.contains("+51987654321"));
        assertThat(sentTo).hasSize(2);
        assertThat(reminderService.listPending().getTotal()).isZero();
    }

    @Test
    void scheduleReminder_FutureSession_StaysPendingUntilCancelled() {
        // Given
        LocalDateTime sessionStart = LocalDateTime.now(properties.getTimeZone()).plusHours(2);
        ReminderScheduleResponse response = reminderService.scheduleReminder(new ScheduleReminderRequest(
                "43", sessionStart, "ana@devs.com", "bob@devs.com", 30, null));

        // When
        boolean first = reminderService.cancelReminder(response.getJobIds().get(0)).isCancelled();
        boolean again = reminderService.cancelReminder(response.getJobIds().get(0)).isCancelled();

        // Then
        assertThat(response.isClamped()).isFalse();
        assertThat(first).isTrue();
        assertThat(again).isFalse();
        assertThat(reminderService.listPending().getTotal()).isEqualTo(1);
        assertThat(sentTo).isEmpty();
    }
}
