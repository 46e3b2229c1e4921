package com.portfoliodevs.notifier.service;

import com.portfoliodevs.notifier.config.SchedulerProperties;
import com.portfoliodevs.notifier.dto.CancelReminderResponse;
import com.portfoliodevs.notifier.dto.PendingReminderDTO;
import com.portfoliodevs.notifier.dto.PendingRemindersResponse;
import com.portfoliodevs.notifier.dto.ReminderScheduleResponse;
import com.portfoliodevs.notifier.dto.ScheduleReminderRequest;
import com.portfoliodevs.notifier.exception.ValidationException;
import com.portfoliodevs.notifier.model.NotificationKind;
import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import com.portfoliodevs.notifier.scheduler.JobPayload;
import com.portfoliodevs.notifier.scheduler.ScheduleReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Schedules the reminders of advisory sessions on the {@link DelayedJobScheduler}.
 * <p>
 * Each session gets two independent jobs, one for the programmer and one for the
 * user, linked by a shared correlation id. Either can fire, fail or be cancelled
 * without affecting the other.
 */
@Service
public class ReminderService {

    private static final Logger logger = LoggerFactory.getLogger(ReminderService.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    static final String ROLE_PROGRAMMER = "programmer";
    static final String ROLE_USER = "user";

    private final DelayedJobScheduler scheduler;
    private final SchedulerProperties properties;

    public ReminderService(DelayedJobScheduler scheduler, SchedulerProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * Schedule the programmer and user reminders for a session.
     * The reminders fire {@code leadMinutes} before the session starts; if that
     * moment has passed they fire shortly after now and the response says so.
     *
     * @throws ValidationException if a required field is missing or the lead time is negative
     */
    public ReminderScheduleResponse scheduleReminder(ScheduleReminderRequest request) {
        validate(request);

        int leadMinutes = request.getLeadMinutes() != null
                ? request.getLeadMinutes()
                : properties.getDefaultLeadMinutes();
        Instant sessionStart = request.getSessionDateTime().atZone(properties.getTimeZone()).toInstant();
        Instant fireAt = sessionStart.minus(Duration.ofMinutes(leadMinutes));
        String correlationId = request.getSessionId() + "-" + UUID.randomUUID().toString().substring(0, 8);

        Map<String, String> context = new HashMap<>();
        context.put("session_id", request.getSessionId());
        context.put("date", request.getSessionDateTime().format(DATE));
        context.put("time", request.getSessionDateTime().format(TIME));
        if (request.getProgrammerName() != null && !request.getProgrammerName().isBlank()) {
            context.put("programmer_name", request.getProgrammerName());
        }

        ScheduleReceipt programmerReceipt = scheduler.schedule(fireAt,
                payload(request, request.getProgrammerRecipient(), ROLE_PROGRAMMER, correlationId, context));
        ScheduleReceipt userReceipt;
        try {
            userReceipt = scheduler.schedule(fireAt,
                    payload(request, request.getUserRecipient(), ROLE_USER, correlationId, context));
        } catch (RuntimeException e) {
            // Keep the request all-or-nothing for the caller
            scheduler.cancel(programmerReceipt.jobId());
            throw e;
        }

        boolean clamped = programmerReceipt.clamped() || userReceipt.clamped();
        logger.info("Scheduled reminders {} and {} for session {} (correlation {}), firing at {}",
                programmerReceipt.jobId(), userReceipt.jobId(), request.getSessionId(),
                correlationId, programmerReceipt.fireAt());

        String message = clamped
                ? "Reminder time has already passed; reminders will be sent in "
                        + properties.getClampDelay().toSeconds() + " seconds"
                : "Reminders scheduled";
        return new ReminderScheduleResponse(
                correlationId,
                List.of(programmerReceipt.jobId(), userReceipt.jobId()),
                programmerReceipt.fireAt().toString(),
                clamped,
                message);
    }

    public PendingRemindersResponse listPending() {
        List<PendingReminderDTO> reminders = scheduler.listPending().stream()
                .map(PendingReminderDTO::from)
                .toList();
        return new PendingRemindersResponse(reminders.size(), reminders);
    }

    public CancelReminderResponse cancelReminder(String jobId) {
        boolean cancelled = scheduler.cancel(jobId);
        if (!cancelled) {
            logger.info("Reminder {} was not pending, nothing cancelled", jobId);
        }
        return new CancelReminderResponse(jobId, cancelled);
    }

    private static JobPayload payload(ScheduleReminderRequest request, String recipient, String role,
                                      String correlationId, Map<String, String> sessionContext) {
        Map<String, String> context = new HashMap<>(sessionContext);
        context.put("role", role);
        String description = "Reminder for advisory session " + request.getSessionId() + " - " + role;
        return new JobPayload(recipient.trim(), NotificationKind.REMINDER, description, correlationId, context);
    }

    private static void validate(ScheduleReminderRequest request) {
        if (request == null) {
            throw new ValidationException("Reminder request is required");
        }
        if (isBlank(request.getSessionId())) {
            throw new ValidationException("Session ID is required");
        }
        if (request.getSessionDateTime() == null) {
            throw new ValidationException("Session date and time is required");
        }
        if (isBlank(request.getProgrammerRecipient())) {
            throw new ValidationException("Programmer recipient is required");
        }
        if (isBlank(request.getUserRecipient())) {
            throw new ValidationException("User recipient is required");
        }
        if (request.getLeadMinutes() != null && request.getLeadMinutes() < 0) {
            throw new ValidationException("Lead minutes must not be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
