package com.portfoliodevs.notifier.exception;

/**
 * Thrown by the direct send endpoints when the channel reports a failed delivery.
 */
public class NotificationDeliveryException extends RuntimeException {

    private final String channel;

    public NotificationDeliveryException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
