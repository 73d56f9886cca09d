package com.ai.booking.service;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.AllocationRequest;
import com.ai.booking.dto.ChangeRequest;
import com.ai.booking.dto.DirectiveOutcome;
import com.ai.booking.dto.TurnDecision;
import com.ai.booking.entity.Booking;
import com.ai.booking.exception.SlotConflictException;
import com.ai.booking.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingDirectiveExecutorTest {

    private static final LocalDate DAY = LocalDate.of(2031, 5, 10);

    @Mock
    private SlotAllocatorService allocator;

    private BookingDirectiveExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new BookingDirectiveExecutor(allocator, properties(List.of("Anna")));
    }

    @Test
    void testExecute_NoActionTouchesNothing() {
        DirectiveOutcome outcome = executor.execute("salon", "c1", TurnDecision.replyOnly("Hello!"));

        assertTrue(outcome.success());
        assertEquals(TurnDecision.Action.NONE, outcome.action());
        verifyNoInteractions(allocator);
    }

    @Test
    void testExecute_ActivateBooksWithOnlySpecialist() {
        // Given
        when(allocator.durationSlotsFor("salon", "Coloring")).thenReturn(3);
        when(allocator.allocate(any(AllocationRequest.class))).thenReturn(booking(5L, LocalTime.of(14, 0), "Coloring"));

        // When
        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("book", null, "10.05.2031", "14:00", "Coloring", null, null));

        // Then
        assertTrue(outcome.success());
        assertEquals(5L, outcome.bookingId());
        ArgumentCaptor<AllocationRequest> captor = ArgumentCaptor.forClass(AllocationRequest.class);
        verify(allocator).allocate(captor.capture());
        AllocationRequest request = captor.getValue();
        assertEquals("Anna", request.specialist());
        assertEquals(DAY, request.date());
        assertEquals(LocalTime.of(14, 0), request.startTime());
        assertEquals(3, request.durationSlots());
        assertEquals("c1", request.clientId());
        assertEquals("Eve", request.clientName());
    }

    @Test
    void testExecute_TakenSlotBecomesPoliteRefusal() {
        when(allocator.durationSlotsFor("salon", "Haircut")).thenReturn(1);
        when(allocator.allocate(any(AllocationRequest.class))).thenThrow(new SlotConflictException(
                SlotConflictException.Source.MIRROR, "Anna", DAY, LocalTime.of(14, 0)));

        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("activate", "anna", "2031-05-10", "14:00", "Haircut", null, null));

        assertFalse(outcome.success());
        assertEquals("Sorry, 10.05.2031 14:00 is already taken. Please choose another time.", outcome.message());
    }

    @Test
    void testExecute_MissingSpecialistWithSeveralToChooseFrom() {
        executor = new BookingDirectiveExecutor(allocator, properties(List.of("Anna", "Maria")));

        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("activate", null, "10.05.2031", "14:00", "Haircut", null, null));

        assertFalse(outcome.success());
        assertEquals("I could not do that: specialist is required", outcome.message());
        verify(allocator, never()).allocate(any());
    }

    @Test
    void testExecute_RejectCancelsMatchingBooking() {
        Booking morning = booking(1L, LocalTime.of(10, 0), "Haircut");
        Booking afternoon = booking(2L, LocalTime.of(15, 0), "Manicure");
        when(allocator.findActiveBookings("salon", "c1")).thenReturn(List.of(afternoon, morning));
        when(allocator.cancel("salon", 1L)).thenReturn(morning);

        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("cancel", null, null, null, null, "10.05.2031", "10:00"));

        assertTrue(outcome.success());
        assertEquals(1L, outcome.bookingId());
        verify(allocator).cancel("salon", 1L);
    }

    @Test
    void testExecute_RejectWithoutBookings() {
        when(allocator.findActiveBookings("salon", "c1")).thenReturn(List.of());

        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("reject", null, null, null, null, null, null));

        assertFalse(outcome.success());
        assertEquals("I could not find that booking.", outcome.message());
        verify(allocator, never()).cancel(any(), any());
    }

    @Test
    void testExecute_ChangeMovesBookingFoundByService() {
        // Given
        Booking haircut = booking(1L, LocalTime.of(10, 0), "Haircut");
        Booking manicure = booking(2L, LocalTime.of(15, 0), "Manicure");
        when(allocator.findActiveBookings("salon", "c1")).thenReturn(List.of(haircut, manicure));
        when(allocator.durationSlotsFor("salon", "Manicure")).thenReturn(2);
        when(allocator.change(any(ChangeRequest.class))).thenReturn(booking(2L, LocalTime.of(16, 0), "Manicure"));

        // When
        DirectiveOutcome outcome = executor.execute("salon", "c1",
                decision("change", null, null, "16:00", "Manicure", null, null));

        // Then
        assertTrue(outcome.success());
        ArgumentCaptor<ChangeRequest> captor = ArgumentCaptor.forClass(ChangeRequest.class);
        verify(allocator).change(captor.capture());
        ChangeRequest request = captor.getValue();
        assertEquals(2L, request.bookingId());
        assertNull(request.date());
        assertNull(request.specialist());
        assertEquals(LocalTime.of(16, 0), request.startTime());
        assertEquals(2, request.durationSlots());
    }

    @Test
    void testParseDate_AcceptedFormats() {
        assertEquals(LocalDate.of(2031, 3, 5), BookingDirectiveExecutor.parseDate("5.3.2031"));
        assertEquals(LocalDate.of(2031, 3, 5), BookingDirectiveExecutor.parseDate("05.03.2031"));
        assertEquals(LocalDate.of(2031, 3, 5), BookingDirectiveExecutor.parseDate("2031-03-05"));
        assertFalse(BookingDirectiveExecutor.parseDate("1.1").isBefore(LocalDate.now().withDayOfYear(1)));
        assertThrows(ValidationException.class, () -> BookingDirectiveExecutor.parseDate("next friday"));
        assertThrows(ValidationException.class, () -> BookingDirectiveExecutor.parseDate(" "));
    }

    @Test
    void testParseTime_AcceptedFormats() {
        assertEquals(LocalTime.of(9, 30), BookingDirectiveExecutor.parseTime("9:30"));
        assertEquals(LocalTime.of(14, 0), BookingDirectiveExecutor.parseTime(" 14:00 "));
        assertThrows(ValidationException.class, () -> BookingDirectiveExecutor.parseTime("2pm"));
    }

    private static TurnDecision decision(String action, String specialist, String date, String time, String service,
                                         String oldDate, String oldTime) {
        return new TurnDecision("ok", action, specialist, date, time, service, "Eve", "+10000000000",
                oldDate, oldTime, null);
    }

    private static Booking booking(Long id, LocalTime start, String service) {
        return Booking.builder()
                .id(id)
                .projectId("salon")
                .specialist("Anna")
                .bookingDate(DAY)
                .startTime(start)
                .durationSlots(1)
                .clientId("c1")
                .serviceName(service)
                .build();
    }

    private static BookingProperties properties(List<String> specialists) {
        BookingProperties.Project project = new BookingProperties.Project(specialists,
                Map.of("Haircut", 30, "Coloring", 90, "Manicure", 60), null, null, null);
        return new BookingProperties(30, "09:00", "18:00", Map.of("salon", project), null, null);
    }
}
