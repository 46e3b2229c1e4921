package com.portfoliodevs.notifier.dto;

import com.portfoliodevs.notifier.model.NotificationKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one delivery made while fanning out a lifecycle event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReport {

    private String channel;
    private String recipient;
    private NotificationKind kind;
    private boolean success;
    private String detail;
}
