package com.ai.booking.utils;

import com.ai.booking.entity.Booking;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class SlotCalculatorTest {

    private static final LocalTime NINE = LocalTime.of(9, 0);
    private static final LocalTime SIX_PM = LocalTime.of(18, 0);

    @Test
    void testGrid_CoversWorkingDayInHalfHours() {
        List<LocalTime> grid = SlotCalculator.grid(NINE, SIX_PM, 30);

        assertEquals(18, grid.size());
        assertEquals(NINE, grid.get(0));
        assertEquals(LocalTime.of(17, 30), grid.get(grid.size() - 1));
    }

    @Test
    void testAvailable_TwoSlotRequestAroundExistingBooking() {
        // Given a 10:00-10:30 booking
        List<LocalTime> grid = SlotCalculator.grid(NINE, SIX_PM, 30);
        Set<LocalTime> occupied = SlotCalculator.occupied(List.of(booking(LocalTime.of(10, 0), 1)), 30);

        // When
        SortedSet<LocalTime> available = SlotCalculator.available(grid, occupied, 2, 30);

        // Then
        assertTrue(available.contains(NINE));
        assertFalse(available.contains(LocalTime.of(9, 30)));
        assertFalse(available.contains(LocalTime.of(10, 0)));
        assertTrue(available.contains(LocalTime.of(10, 30)));
        assertFalse(available.contains(LocalTime.of(17, 30)), "two slots from 17:30 end after closing");
        assertEquals(LocalTime.of(17, 0), available.last());
    }

    @Test
    void testOccupied_IgnoresCancelledBookings() {
        Booking cancelled = booking(LocalTime.of(11, 0), 2);
        cancelled.setStatus(Booking.Status.CANCELLED);

        Set<LocalTime> occupied = SlotCalculator.occupied(List.of(cancelled, booking(NINE, 1)), 30);

        assertEquals(Set.of(NINE), occupied);
    }

    @Test
    void testFits_BackToBackIsNotAConflict() {
        List<LocalTime> grid = SlotCalculator.grid(NINE, SIX_PM, 30);
        Set<LocalTime> occupied = SlotCalculator.occupied(List.of(booking(NINE, 2)), 30);

        assertTrue(SlotCalculator.fits(LocalTime.of(10, 0), 1, 30, grid, occupied));
        assertFalse(SlotCalculator.fits(LocalTime.of(9, 30), 1, 30, grid, occupied));
    }

    @Test
    void testFits_RejectsOffGridStart() {
        List<LocalTime> grid = SlotCalculator.grid(NINE, SIX_PM, 30);

        assertFalse(SlotCalculator.fits(LocalTime.of(10, 15), 1, 30, grid, Set.of()));
    }

    @Test
    void testSlotsForMinutes_RoundsUp() {
        assertEquals(1, SlotCalculator.slotsForMinutes(30, 30));
        assertEquals(2, SlotCalculator.slotsForMinutes(45, 30));
        assertEquals(3, SlotCalculator.slotsForMinutes(90, 30));
        assertEquals(1, SlotCalculator.slotsForMinutes(0, 30));
    }

    @Test
    void testCovered_StopsAtMidnight() {
        assertEquals(List.of(LocalTime.of(23, 30)), SlotCalculator.covered(LocalTime.of(23, 30), 3, 30));
    }

    private static Booking booking(LocalTime start, int slots) {
        return Booking.builder()
                .projectId("salon")
                .specialist("Anna")
                .bookingDate(LocalDate.of(2030, 1, 10))
                .startTime(start)
                .durationSlots(slots)
                .clientId("c1")
                .build();
    }
}
