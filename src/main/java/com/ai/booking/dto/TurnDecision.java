package com.ai.booking.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

/**
 * What the language model decided for one turn: the text to send back and
 * an optional booking action with its arguments as the model wrote them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnDecision(
        @JsonProperty("reply") String reply,
        @JsonProperty("action") String action,
        @JsonProperty("specialist") String specialist,
        @JsonProperty("date") String date,
        @JsonProperty("time") String time,
        @JsonProperty("service") String service,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("phone") String phone,
        @JsonProperty("old_date") String oldDate,
        @JsonProperty("old_time") String oldTime,
        @JsonProperty("feedback") String feedback
) {

    public enum Action {
        NONE,
        ACTIVATE,
        REJECT,
        CHANGE
    }

    public static TurnDecision replyOnly(String reply) {
        return new TurnDecision(reply, null, null, null, null, null, null, null, null, null, null);
    }

    public Action actionType() {
        String value = StringUtils.trimToEmpty(action).toLowerCase();
        return switch (value) {
            case "activate", "book" -> Action.ACTIVATE;
            case "reject", "cancel" -> Action.REJECT;
            case "change", "reschedule" -> Action.CHANGE;
            default -> Action.NONE;
        };
    }
}
