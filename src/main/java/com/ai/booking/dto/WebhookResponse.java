package com.ai.booking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The calling platform sends {@code reply} to the client only when
 * {@code send_status} is TRUE.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(
        @JsonProperty("send_status") String sendStatus,
        @JsonProperty("count") Integer count,
        @JsonProperty("reply") String reply,
        @JsonProperty("status") String status,
        @JsonProperty("user_message") String userMessage
) {

    public static WebhookResponse from(TurnResponse response, Integer count, String userMessage) {
        return new WebhookResponse(
                response.shouldDeliver() ? "TRUE" : "FALSE",
                count,
                response.getReply(),
                response.getType().name().toLowerCase(),
                response.getAggregatedText() != null ? response.getAggregatedText() : userMessage);
    }
}
