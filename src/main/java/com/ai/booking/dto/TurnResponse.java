package com.ai.booking.dto;

/**
 * What the channel adapter should do once a turn has resolved. Only
 * {@link Type#REPLY} carries text for the client.
 */
public final class TurnResponse {

    public enum Type {
        REPLY,
        SUPERSEDED,
        SKIPPED,
        FAILED
    }

    private final Type type;
    private final String itemId;
    private final String aggregatedText;
    private final String reply;

    private TurnResponse(Type type, String itemId, String aggregatedText, String reply) {
        this.type = type;
        this.itemId = itemId;
        this.aggregatedText = aggregatedText;
        this.reply = reply;
    }

    public static TurnResponse reply(String itemId, String aggregatedText, String reply) {
        return new TurnResponse(Type.REPLY, itemId, aggregatedText, reply);
    }

    public static TurnResponse superseded(String itemId, String aggregatedText) {
        return new TurnResponse(Type.SUPERSEDED, itemId, aggregatedText, null);
    }

    public static TurnResponse skipped() {
        return new TurnResponse(Type.SKIPPED, null, null, null);
    }

    public static TurnResponse failed(String itemId, String aggregatedText) {
        return new TurnResponse(Type.FAILED, itemId, aggregatedText, null);
    }

    public Type getType() {
        return type;
    }

    public boolean shouldDeliver() {
        return type == Type.REPLY;
    }

    public String getItemId() {
        return itemId;
    }

    public String getAggregatedText() {
        return aggregatedText;
    }

    public String getReply() {
        return reply;
    }
}
