package com.ai.booking.mirror;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

/**
 * Human-editable copy of the schedule, addressed by specialist, date and slot
 * start. Every call may fail independently with a
 * {@link com.ai.booking.exception.MirrorSyncException}.
 */
public interface BookingMirror {

    /** False when the project has no mirror configured; callers then skip it entirely. */
    boolean isEnabled(String projectId);

    void setSlot(String projectId, String specialist, LocalDate date, LocalTime time, MirrorRecord record);

    void clearSlot(String projectId, String specialist, LocalDate date, LocalTime time);

    Optional<MirrorRecord> readSlot(String projectId, String specialist, LocalDate date, LocalTime time);

    /** Occupied cells of one day keyed by slot start. */
    Map<LocalTime, MirrorRecord> readDay(String projectId, String specialist, LocalDate date);
}
