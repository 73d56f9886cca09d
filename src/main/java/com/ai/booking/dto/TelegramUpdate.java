package com.ai.booking.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
        @JsonProperty("update_id") Long updateId,
        @JsonProperty("message") Message message
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(
            @JsonProperty("message_id") Long messageId,
            @JsonProperty("chat") Chat chat,
            @JsonProperty("text") String text
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(@JsonProperty("id") Long id) {
    }

    public Long chatId() {
        return message != null && message.chat() != null ? message.chat().id() : null;
    }

    public String text() {
        return message != null ? message.text() : null;
    }
}
