package com.ai.booking.dto;

import java.time.LocalDate;
import java.time.LocalTime;

public record AllocationRequest(
        String projectId,
        String specialist,
        LocalDate date,
        LocalTime startTime,
        int durationSlots,
        String clientId,
        String clientName,
        String clientPhone,
        String serviceName,
        String notes
) {
}
