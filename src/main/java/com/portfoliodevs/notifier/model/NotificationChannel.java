package com.portfoliodevs.notifier.model;

/**
 * Channels through which the requesting user wants to be notified.
 */
public enum NotificationChannel {
    EMAIL,
    WHATSAPP,
    BOTH;

    public boolean includesEmail() {
        return this == EMAIL || this == BOTH;
    }

    public boolean includesWhatsApp() {
        return this == WHATSAPP || this == BOTH;
    }
}
