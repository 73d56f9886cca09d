package com.ai.booking.mirror;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.ReconcileReport;
import com.ai.booking.entity.Booking;
import com.ai.booking.exception.MirrorSyncException;
import com.ai.booking.repository.BookingRepository;
import com.ai.booking.service.ScheduleLockScope;
import com.ai.booking.service.ScheduleLockScope.DayKey;
import com.ai.booking.utils.SlotCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Periodically brings the local store in line with the spreadsheet. The
 * spreadsheet wins, except for bookings whose latest state has not reached it
 * yet; those are pushed again.
 */
@Service
public class MirrorReconciler {

    private static final Logger log = LoggerFactory.getLogger(MirrorReconciler.class);

    static final String IMPORTED_NOTE = "Imported from spreadsheet";

    private final BookingMirror mirror;
    private final BookingRepository bookingRepository;
    private final ScheduleLockScope lockScope;
    private final MirrorSyncService mirrorSyncService;
    private final BookingProperties properties;

    public MirrorReconciler(BookingMirror mirror,
                            BookingRepository bookingRepository,
                            ScheduleLockScope lockScope,
                            MirrorSyncService mirrorSyncService,
                            BookingProperties properties) {
        this.mirror = mirror;
        this.bookingRepository = bookingRepository;
        this.lockScope = lockScope;
        this.mirrorSyncService = mirrorSyncService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${booking.mirror.reconcile-interval:PT5M}",
            initialDelayString = "${booking.mirror.reconcile-initial-delay:PT1M}")
    public void reconcileAll() {
        int days = properties.safeMirror().safeReconcileDays();
        LocalDate today = LocalDate.now();
        for (Map.Entry<String, BookingProperties.Project> entry : properties.safeProjects().entrySet()) {
            String projectId = entry.getKey();
            if (!mirror.isEnabled(projectId)) {
                continue;
            }
            for (String specialist : entry.getValue().safeSpecialists()) {
                for (int i = 0; i < days; i++) {
                    LocalDate date = today.plusDays(i);
                    try {
                        reconcileDay(projectId, specialist, date);
                    } catch (MirrorSyncException e) {
                        log.warn("Skipping reconciliation of {} {} {}: {}", projectId, specialist, date, e.getMessage());
                    } catch (RuntimeException e) {
                        log.error("Reconciliation of {} {} {} failed", projectId, specialist, date, e);
                    }
                }
            }
        }
    }

    public ReconcileReport reconcileDay(String projectId, String specialist, LocalDate date) {
        if (!mirror.isEnabled(projectId)) {
            log.debug("Mirror disabled for {}, nothing to reconcile", projectId);
            return ReconcileReport.untouched(projectId, specialist, date);
        }
        int slotMinutes = properties.safeSlotMinutes();
        Instant readStartedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        List<MirrorBooking> mirrorBookings = collapse(mirror.readDay(projectId, specialist, date), slotMinutes);

        List<Long> toPush = new ArrayList<>();
        ReconcileReport report = lockScope.withDayLock(projectId, List.of(new DayKey(specialist, date)),
                () -> apply(projectId, specialist, date, mirrorBookings, readStartedAt, toPush));

        toPush.forEach(mirrorSyncService::pushBooking);
        if (report.hasChanges()) {
            log.info("Reconciled {} {} {}: repushed={} cancelled={} updated={} imported={} skipped={}",
                    projectId, specialist, date, report.repushed(), report.cancelled(), report.updated(),
                    report.imported(), report.skipped());
        }
        return report;
    }

    private ReconcileReport apply(String projectId, String specialist, LocalDate date,
                                  List<MirrorBooking> mirrorBookings, Instant readStartedAt, List<Long> toPush) {
        int slotMinutes = properties.safeSlotMinutes();
        List<Booking> active = bookingRepository.findByProjectIdAndSpecialistAndBookingDateAndStatusOrderByStartTimeAsc(
                projectId, specialist, date, Booking.Status.ACTIVE);
        List<LocalTime> grid = SlotCalculator.grid(properties.workStartFor(projectId), properties.workEndFor(projectId), slotMinutes);
        Map<LocalTime, MirrorBooking> byStart = new HashMap<>();
        mirrorBookings.forEach(mb -> byStart.put(mb.start, mb));

        int repushed = 0, cancelled = 0, updated = 0, imported = 0, skipped = 0;
        Set<LocalTime> occupied = new HashSet<>();
        List<Booking> synced = new ArrayList<>();

        // local state the spreadsheet has not seen yet
        for (Booking booking : active) {
            if (!syncedBefore(booking, readStartedAt)) {
                toPush.add(booking.getId());
                occupied.addAll(SlotCalculator.covered(booking.getStartTime(), booking.getDurationSlots(), slotMinutes));
                repushed++;
            } else {
                synced.add(booking);
            }
        }

        Set<LocalTime> matched = new HashSet<>();
        for (Booking booking : synced) {
            MirrorBooking mb = byStart.get(booking.getStartTime());
            if (mb == null) {
                booking.setStatus(Booking.Status.CANCELLED);
                log.info("Booking {} removed from spreadsheet, cancelling", booking.getId());
                cancelled++;
                continue;
            }
            matched.add(mb.start);
            List<LocalTime> range = SlotCalculator.covered(mb.start, mb.slots, slotMinutes);
            if (!onGrid(mb, grid, slotMinutes)) {
                log.warn("Spreadsheet change to booking {} runs past working hours ({} x{}), leaving it",
                        booking.getId(), mb.start, mb.slots);
                occupied.addAll(SlotCalculator.covered(booking.getStartTime(), booking.getDurationSlots(), slotMinutes));
                skipped++;
                continue;
            }
            if (range.stream().anyMatch(occupied::contains)) {
                log.warn("Spreadsheet change to booking {} overlaps unsynced bookings, leaving it", booking.getId());
                occupied.addAll(SlotCalculator.covered(booking.getStartTime(), booking.getDurationSlots(), slotMinutes));
                skipped++;
                continue;
            }
            if (mb.record.differsFrom(booking) || mb.slots != booking.getDurationSlots()) {
                booking.setClientId(mb.record.clientId());
                booking.setClientName(mb.record.clientName());
                booking.setServiceName(mb.record.serviceName());
                booking.setDurationSlots(mb.slots);
                log.info("Booking {} updated from spreadsheet", booking.getId());
                updated++;
            }
            occupied.addAll(range);
        }

        for (MirrorBooking mb : mirrorBookings) {
            if (matched.contains(mb.start)) {
                continue;
            }
            if (!onGrid(mb, grid, slotMinutes)) {
                log.warn("Spreadsheet booking {} {} {} x{} is off the slot grid or outside working hours, not importing",
                        specialist, date, mb.start, mb.slots);
                skipped++;
                continue;
            }
            List<LocalTime> range = SlotCalculator.covered(mb.start, mb.slots, slotMinutes);
            if (range.stream().anyMatch(occupied::contains)) {
                log.warn("Spreadsheet booking {} {} {} overlaps unsynced bookings, not importing", specialist, date, mb.start);
                skipped++;
                continue;
            }
            Booking saved = bookingRepository.save(Booking.builder()
                    .projectId(projectId)
                    .specialist(specialist)
                    .bookingDate(date)
                    .startTime(mb.start)
                    .durationSlots(mb.slots)
                    .clientId(mb.record.clientId())
                    .clientName(mb.record.clientName())
                    .serviceName(mb.record.serviceName())
                    .notes(IMPORTED_NOTE)
                    .mirrorState(Booking.MirrorState.SYNCED)
                    .mirrorSyncedAt(Instant.now())
                    .build());
            log.info("Imported spreadsheet booking {} ({} {} {})", saved.getId(), specialist, date, mb.start);
            occupied.addAll(range);
            imported++;
        }

        return new ReconcileReport(projectId, specialist, date, repushed, cancelled, updated, imported, skipped);
    }

    /**
     * True when the mirror confirmed the booking's current state before the
     * day was read, so the snapshot is expected to contain it.
     */
    static boolean syncedBefore(Booking booking, Instant readStartedAt) {
        return booking.getMirrorState() == Booking.MirrorState.SYNCED
                && booking.getMirrorSyncedAt() != null
                && booking.getMirrorSyncedAt().isBefore(readStartedAt)
                && !booking.getUpdatedAt().isAfter(readStartedAt);
    }

    private static boolean onGrid(MirrorBooking mb, List<LocalTime> grid, int slotMinutes) {
        return SlotCalculator.fits(mb.start, mb.slots, slotMinutes, grid, Set.of());
    }

    /**
     * Groups a head row and the continuation rows directly after it into one
     * booking. Continuation rows without a head are ignored.
     */
    static List<MirrorBooking> collapse(Map<LocalTime, MirrorRecord> cells, int slotMinutes) {
        List<MirrorBooking> result = new ArrayList<>();
        MirrorBooking current = null;
        for (Map.Entry<LocalTime, MirrorRecord> entry : new TreeMap<>(cells).entrySet()) {
            LocalTime time = entry.getKey();
            MirrorRecord record = entry.getValue();
            if (record == null || !record.isOccupied()) {
                current = null;
                continue;
            }
            if (record.continuation()) {
                if (current != null && time.equals(current.nextStart(slotMinutes))) {
                    current.slots++;
                } else {
                    log.debug("Orphan continuation row at {}", time);
                    current = null;
                }
                continue;
            }
            current = new MirrorBooking(time, record);
            result.add(current);
        }
        return result;
    }

    static final class MirrorBooking {
        final LocalTime start;
        final MirrorRecord record;
        int slots = 1;

        MirrorBooking(LocalTime start, MirrorRecord record) {
            this.start = start;
            this.record = record;
        }

        LocalTime nextStart(int slotMinutes) {
            return start.plusMinutes((long) slots * slotMinutes);
        }
    }
}
