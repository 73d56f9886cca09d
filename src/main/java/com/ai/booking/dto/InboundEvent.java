package com.ai.booking.dto;

/**
 * One delivery from a channel adapter. {@code deliveryCount} is the
 * platform's count of prior deliveries of the same logical event.
 */
public record InboundEvent(
        String projectId,
        String clientId,
        String channel,
        String text,
        boolean retry,
        int deliveryCount
) {

    public static InboundEvent firstDelivery(String projectId, String clientId, String channel, String text) {
        return new InboundEvent(projectId, clientId, channel, text, false, 1);
    }
}
