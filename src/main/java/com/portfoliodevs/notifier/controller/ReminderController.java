package com.portfoliodevs.notifier.controller;

import com.portfoliodevs.notifier.dto.CancelReminderResponse;
import com.portfoliodevs.notifier.dto.PendingRemindersResponse;
import com.portfoliodevs.notifier.dto.ReminderScheduleResponse;
import com.portfoliodevs.notifier.dto.ScheduleReminderRequest;
import com.portfoliodevs.notifier.service.ReminderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Scheduling, listing and cancelling of advisory session reminders.
 */
@RestController
@RequestMapping("/api/notifications/reminders")
@Tag(name = "Reminders", description = "Delayed reminders for advisory sessions")
public class ReminderController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ReminderController.class);

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping
    @Operation(summary = "Schedule session reminders",
               description = "Schedules one reminder for the programmer and one for the user, "
                       + "sent leadMinutes before the session. Returns the job ids immediately.")
    public ResponseEntity<ReminderScheduleResponse> scheduleReminder(
            @Valid @RequestBody ScheduleReminderRequest request) {
        logger.info("Scheduling reminders for session {} at {}", request.getSessionId(), request.getSessionDateTime());
        ReminderScheduleResponse response = reminderService.scheduleReminder(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/pending")
    @Operation(summary = "List pending reminders",
               description = "Returns reminders that have not fired or been cancelled, earliest first.")
    public ResponseEntity<PendingRemindersResponse> listPending() {
        return ResponseEntity.ok(reminderService.listPending());
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel a pending reminder",
               description = "Cancels the reminder if it has not fired yet. cancelled=false means it was "
                       + "unknown, already sent or already cancelled.")
    public ResponseEntity<CancelReminderResponse> cancelReminder(
            @Parameter(description = "Job ID returned when the reminder was scheduled") @PathVariable String jobId) {
        return ResponseEntity.ok(reminderService.cancelReminder(jobId));
    }
}
