package com.portfoliodevs.notifier.dto;

import com.portfoliodevs.notifier.model.AdvisoryStatus;
import com.portfoliodevs.notifier.model.NotificationChannel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Lifecycle event of an advisory session, sent by the booking back end
 * whenever a session is created or changes status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvisoryNotificationRequest {

    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotNull(message = "Status is required")
    private AdvisoryStatus status;

    @NotBlank(message = "User email is required")
    @Email(message = "User email is not valid")
    private String userEmail;

    private String userName;

    private String userPhone; // Needed for WhatsApp delivery

    @NotBlank(message = "Programmer email is required")
    @Email(message = "Programmer email is not valid")
    private String programmerEmail;

    private String programmerName;

    private String date;

    private String time;

    private String reason;

    private String responseMessage;

    @Builder.Default
    private NotificationChannel channel = NotificationChannel.EMAIL;
}
