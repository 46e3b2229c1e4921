package com.portfoliodevs.notifier.model;

/**
 * Template kind of an outbound notification.
 * Drives subject and body layout; the actual text can be overridden per message.
 */
public enum NotificationKind {
    NEW_REQUEST,
    APPROVED,
    REJECTED,
    REMINDER,
    GENERIC
}
