package com.ai.booking.exception;

/**
 * Failure talking to the spreadsheet mirror. Never fails a booking operation;
 * the reconciliation pass heals whatever was left behind.
 */
public class MirrorSyncException extends RuntimeException {

    public MirrorSyncException(String message) {
        super(message);
    }

    public MirrorSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
