package com.portfoliodevs.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * Request DTO for scheduling the reminders of an advisory session.
 * Recipients are email addresses or phone numbers in international format.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleReminderRequest {

    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotNull(message = "Session date and time is required")
    private LocalDateTime sessionDateTime;

    @NotBlank(message = "Programmer recipient is required")
    private String programmerRecipient;

    @NotBlank(message = "User recipient is required")
    private String userRecipient;

    @Min(value = 0, message = "Lead minutes must not be negative")
    private Integer leadMinutes; // Defaults to scheduler.default-lead-minutes

    private String programmerName;
}
