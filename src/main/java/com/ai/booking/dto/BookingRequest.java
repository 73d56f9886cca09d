package com.ai.booking.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Admin booking body, used for create (all slot fields required) and change
 * (absent fields keep their value).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BookingRequest(
        @JsonProperty("specialist") String specialist,
        @JsonProperty("date") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
        @JsonProperty("time") @JsonFormat(pattern = "HH:mm") LocalTime time,
        @JsonProperty("duration_slots") Integer durationSlots,
        @JsonProperty("service") String service,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("client_phone") String clientPhone,
        @JsonProperty("notes") String notes
) {
}
