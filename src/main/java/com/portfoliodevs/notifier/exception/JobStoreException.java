package com.portfoliodevs.notifier.exception;

/**
 * Exception thrown when the pending-job checkpoint cannot be read or written.
 * Wraps lower-level I/O exceptions with meaningful messages.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
