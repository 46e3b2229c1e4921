package com.portfoliodevs.notifier.dto;

import com.portfoliodevs.notifier.model.NotificationKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request DTO for sending a single email right away.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailRequest {

    @NotBlank(message = "Recipient is required")
    @Email(message = "Recipient is not a valid email address")
    private String recipient;

    @NotBlank(message = "Subject is required")
    private String subject;

    @NotBlank(message = "Message is required")
    private String message;

    private NotificationKind kind = NotificationKind.GENERIC;

    private Map<String, String> data;
}
