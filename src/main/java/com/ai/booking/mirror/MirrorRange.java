package com.ai.booking.mirror;

import com.ai.booking.entity.Booking;

import java.time.LocalDate;
import java.time.LocalTime;

public record MirrorRange(String projectId, String specialist, LocalDate date, LocalTime start, int durationSlots) {

    public static MirrorRange of(Booking booking) {
        return new MirrorRange(booking.getProjectId(), booking.getSpecialist(), booking.getBookingDate(),
                booking.getStartTime(), booking.getDurationSlots());
    }
}
