package com.ai.booking.dto;

/**
 * Result of carrying out a booking action. A failed outcome is a normal
 * business answer (slot taken, booking not found), not an error.
 */
public record DirectiveOutcome(TurnDecision.Action action, boolean success, String message, Long bookingId) {

    public static DirectiveOutcome none() {
        return new DirectiveOutcome(TurnDecision.Action.NONE, true, null, null);
    }

    public static DirectiveOutcome success(TurnDecision.Action action, String message, Long bookingId) {
        return new DirectiveOutcome(action, true, message, bookingId);
    }

    public static DirectiveOutcome failure(TurnDecision.Action action, String message) {
        return new DirectiveOutcome(action, false, message, null);
    }
}
