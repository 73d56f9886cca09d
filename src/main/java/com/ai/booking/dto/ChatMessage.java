package com.ai.booking.dto;

public record ChatMessage(String role, String content) {
}
