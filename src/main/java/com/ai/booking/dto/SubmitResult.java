package com.ai.booking.dto;

import com.ai.booking.entity.QueuedMessage;

/**
 * Outcome of handing an inbound event to the coordinator.
 */
public final class SubmitResult {

    public enum Type {
        SKIPPED,
        QUEUED
    }

    private final Type type;
    private final QueuedMessage item;

    private SubmitResult(Type type, QueuedMessage item) {
        this.type = type;
        this.item = item;
    }

    public static SubmitResult skipped() {
        return new SubmitResult(Type.SKIPPED, null);
    }

    public static SubmitResult queued(QueuedMessage item) {
        return new SubmitResult(Type.QUEUED, item);
    }

    public Type getType() {
        return type;
    }

    public boolean isSkipped() {
        return type == Type.SKIPPED;
    }

    /** The new PENDING row; {@code null} when skipped. */
    public QueuedMessage getItem() {
        return item;
    }

    public String getItemId() {
        return item != null ? item.getId() : null;
    }

    public String getAggregatedText() {
        return item != null ? item.getAggregatedText() : null;
    }
}
