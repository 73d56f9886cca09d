package com.ai.booking.exception;

/**
 * Malformed or out-of-range booking input. Raised before any lock is taken.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
