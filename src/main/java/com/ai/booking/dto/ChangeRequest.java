package com.ai.booking.dto;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Target of a booking change. Null fields keep the booking's current value.
 */
public record ChangeRequest(
        String projectId,
        Long bookingId,
        String specialist,
        LocalDate date,
        LocalTime startTime,
        Integer durationSlots,
        String serviceName
) {
}
