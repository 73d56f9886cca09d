package com.ai.booking.dto;

public record TurnResult(String replyText, DirectiveOutcome outcome) {
}
