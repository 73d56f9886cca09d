package com.ai.booking.mirror;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.entity.Booking;
import com.ai.booking.repository.BookingRepository;
import com.ai.booking.utils.SlotCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Best-effort writes of committed bookings to the mirror. Runs on the mirror
 * executor so callers never wait on the spreadsheet; the outcome lands in
 * {@link Booking#getMirrorState()} for the reconciler to pick up.
 */
@Service
public class MirrorSyncService {

    private static final Logger log = LoggerFactory.getLogger(MirrorSyncService.class);

    private final BookingMirror mirror;
    private final BookingRepository bookingRepository;
    private final BookingProperties properties;
    private final Executor mirrorExecutor;

    public MirrorSyncService(BookingMirror mirror,
                             BookingRepository bookingRepository,
                             BookingProperties properties,
                             @Qualifier("mirrorExecutor") Executor mirrorExecutor) {
        this.mirror = mirror;
        this.bookingRepository = bookingRepository;
        this.properties = properties;
        this.mirrorExecutor = mirrorExecutor;
    }

    public void pushBooking(Long bookingId) {
        submit("push " + bookingId, () -> pushNow(bookingId));
    }

    public void clearRange(MirrorRange range) {
        submit("clear " + range, () -> clearNow(range));
    }

    /** Clears the previous range, then writes the booking's current one. */
    public void moveBooking(MirrorRange previous, Long bookingId) {
        submit("move " + bookingId, () -> {
            clearNow(previous);
            pushNow(bookingId);
        });
    }

    void pushNow(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId).orElse(null);
        if (booking == null || !booking.isActive()) {
            log.debug("Booking {} gone or cancelled, nothing to push", bookingId);
            return;
        }
        if (!mirror.isEnabled(booking.getProjectId())) {
            return;
        }
        List<LocalTime> slots = SlotCalculator.covered(booking.getStartTime(), booking.getDurationSlots(),
                properties.safeSlotMinutes());
        try {
            for (int i = 0; i < slots.size(); i++) {
                MirrorRecord record = i == 0 ? MirrorRecord.of(booking) : MirrorRecord.continuationRow();
                mirror.setSlot(booking.getProjectId(), booking.getSpecialist(), booking.getBookingDate(), slots.get(i), record);
            }
            bookingRepository.markSynced(bookingId, booking.getVersion(), Instant.now());
            log.info("Booking {} written to mirror ({} {} {})", bookingId, booking.getSpecialist(),
                    booking.getBookingDate(), booking.getStartTime());
        } catch (RuntimeException e) {
            log.warn("Mirror write failed for booking {}: {}", bookingId, e.getMessage());
            bookingRepository.updateMirrorState(bookingId, booking.getVersion(), Booking.MirrorState.FAILED);
        }
    }

    void clearNow(MirrorRange range) {
        if (!mirror.isEnabled(range.projectId())) {
            return;
        }
        try {
            for (LocalTime slot : SlotCalculator.covered(range.start(), range.durationSlots(), properties.safeSlotMinutes())) {
                mirror.clearSlot(range.projectId(), range.specialist(), range.date(), slot);
            }
            log.info("Mirror range cleared: {}", range);
        } catch (RuntimeException e) {
            log.warn("Mirror clear failed for {}: {}", range, e.getMessage());
        }
    }

    private void submit(String description, Runnable task) {
        try {
            mirrorExecutor.execute(task);
        } catch (TaskRejectedException e) {
            log.warn("Mirror task rejected ({}), reconciliation will retry: {}", description, e.getMessage());
        }
    }
}
