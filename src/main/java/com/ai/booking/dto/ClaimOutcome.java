package com.ai.booking.dto;

public enum ClaimOutcome {
    WIN,
    LOSE
}
