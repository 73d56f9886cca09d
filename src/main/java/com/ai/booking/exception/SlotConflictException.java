package com.ai.booking.exception;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * The requested range is occupied at commit time, either in the local store
 * or in the spreadsheet mirror.
 */
public class SlotConflictException extends RuntimeException {

    public enum Source { LOCAL, MIRROR }

    private final Source source;
    private final String specialist;
    private final LocalDate date;
    private final LocalTime startTime;

    public SlotConflictException(Source source, String specialist, LocalDate date, LocalTime startTime) {
        super("Slot " + specialist + " " + date + " " + startTime + " is not available (" + source.name().toLowerCase() + ")");
        this.source = source;
        this.specialist = specialist;
        this.date = date;
        this.startTime = startTime;
    }

    public Source getSource() {
        return source;
    }

    public String getSpecialist() {
        return specialist;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getStartTime() {
        return startTime;
    }
}
