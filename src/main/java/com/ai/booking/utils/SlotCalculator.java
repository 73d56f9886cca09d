package com.ai.booking.utils;

import com.ai.booking.entity.Booking;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Slot arithmetic over one specialist's working day. All times are slot
 * starts on a grid beginning at the work start.
 */
public final class SlotCalculator {

    private SlotCalculator() {
    }

    /** Slot starts whose whole slot ends no later than {@code workEnd}. */
    public static List<LocalTime> grid(LocalTime workStart, LocalTime workEnd, int slotMinutes) {
        List<LocalTime> slots = new ArrayList<>();
        int end = minutesOf(workEnd);
        for (int t = minutesOf(workStart); t + slotMinutes <= end; t += slotMinutes) {
            slots.add(timeOf(t));
        }
        return slots;
    }

    /**
     * Slot starts covered by a range of {@code durationSlots} slots. Stops at
     * midnight rather than wrapping.
     */
    public static List<LocalTime> covered(LocalTime start, int durationSlots, int slotMinutes) {
        List<LocalTime> slots = new ArrayList<>(durationSlots);
        int t = minutesOf(start);
        for (int i = 0; i < durationSlots && t < 24 * 60; i++, t += slotMinutes) {
            slots.add(timeOf(t));
        }
        return slots;
    }

    public static Set<LocalTime> occupied(Collection<Booking> bookings, int slotMinutes) {
        Set<LocalTime> occupied = new HashSet<>();
        for (Booking booking : bookings) {
            if (booking.isActive()) {
                occupied.addAll(covered(booking.getStartTime(), booking.getDurationSlots(), slotMinutes));
            }
        }
        return occupied;
    }

    /**
     * True when every slot of the range is on the grid and free.
     */
    public static boolean fits(LocalTime start, int durationSlots, int slotMinutes,
                               List<LocalTime> grid, Set<LocalTime> occupied) {
        if (durationSlots < 1) {
            return false;
        }
        List<LocalTime> range = covered(start, durationSlots, slotMinutes);
        if (range.size() < durationSlots) {
            return false;
        }
        Set<LocalTime> onGrid = new HashSet<>(grid);
        for (LocalTime slot : range) {
            if (!onGrid.contains(slot) || occupied.contains(slot)) {
                return false;
            }
        }
        return true;
    }

    public static SortedSet<LocalTime> available(List<LocalTime> grid, Set<LocalTime> occupied,
                                                 int durationSlots, int slotMinutes) {
        SortedSet<LocalTime> result = new TreeSet<>();
        for (LocalTime start : grid) {
            if (fits(start, durationSlots, slotMinutes, grid, occupied)) {
                result.add(start);
            }
        }
        return result;
    }

    /** Minutes rounded up to whole slots, at least one. */
    public static int slotsForMinutes(int minutes, int slotMinutes) {
        if (minutes <= 0) {
            return 1;
        }
        return (minutes + slotMinutes - 1) / slotMinutes;
    }

    private static int minutesOf(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    private static LocalTime timeOf(int minutes) {
        return LocalTime.of(minutes / 60, minutes % 60);
    }
}
