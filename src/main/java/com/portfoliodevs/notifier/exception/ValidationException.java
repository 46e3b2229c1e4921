package com.portfoliodevs.notifier.exception;

/**
 * Thrown when a request is rejected synchronously because its input is invalid.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
