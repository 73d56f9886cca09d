package com.ai.booking.exception;

/**
 * The turn processor could not produce a reply, typically because the
 * language model call failed.
 */
public class TurnProcessingException extends RuntimeException {

    public TurnProcessingException(String message) {
        super(message);
    }

    public TurnProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
