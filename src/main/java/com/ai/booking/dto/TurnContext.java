package com.ai.booking.dto;

import com.ai.booking.entity.Booking;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Facts handed to the language model alongside the dialogue.
 */
public record TurnContext(
        LocalDate today,
        List<String> specialists,
        Map<String, Integer> servicesMinutes,
        Map<String, Map<LocalDate, SortedSet<LocalTime>>> availability,
        List<Booking> clientBookings
) {
}
