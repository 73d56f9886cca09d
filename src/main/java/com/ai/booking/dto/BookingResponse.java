package com.ai.booking.dto;

import com.ai.booking.entity.Booking;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;

public record BookingResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("specialist") String specialist,
        @JsonProperty("date") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
        @JsonProperty("time") @JsonFormat(pattern = "HH:mm") LocalTime time,
        @JsonProperty("duration_slots") int durationSlots,
        @JsonProperty("service") String service,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("client_phone") String clientPhone,
        @JsonProperty("status") String status,
        @JsonProperty("mirror_state") String mirrorState
) {

    public static BookingResponse from(Booking b) {
        return new BookingResponse(b.getId(), b.getProjectId(), b.getSpecialist(), b.getBookingDate(),
                b.getStartTime(), b.getDurationSlots(), b.getServiceName(), b.getClientId(), b.getClientName(),
                b.getClientPhone(), b.getStatus().name(), b.getMirrorState().name());
    }
}
