package com.ai.booking.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic chat-platform webhook body. {@code count} is how many times the
 * platform has delivered this event before.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookRequest(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("client_id") @JsonAlias({"tg_id", "contact_id"}) String clientId,
        @JsonProperty("text") @JsonAlias({"response", "message"}) String text,
        @JsonProperty("retry") Boolean retry,
        @JsonProperty("count") Integer count
) {

    public InboundEvent toEvent(String channel) {
        return new InboundEvent(projectId, clientId, channel, text,
                Boolean.TRUE.equals(retry), count != null ? count : 1);
    }
}
