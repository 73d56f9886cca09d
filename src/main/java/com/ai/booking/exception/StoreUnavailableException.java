package com.ai.booking.exception;

/**
 * The relational store rejected or could not run a coordinator transaction.
 * Nothing from that transaction was committed.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
