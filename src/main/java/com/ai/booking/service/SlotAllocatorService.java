package com.ai.booking.service;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.AllocationRequest;
import com.ai.booking.dto.ChangeRequest;
import com.ai.booking.entity.Booking;
import com.ai.booking.exception.BookingNotFoundException;
import com.ai.booking.exception.SlotConflictException;
import com.ai.booking.exception.ValidationException;
import com.ai.booking.mirror.BookingMirror;
import com.ai.booking.mirror.MirrorRange;
import com.ai.booking.mirror.MirrorRecord;
import com.ai.booking.mirror.MirrorSyncService;
import com.ai.booking.repository.BookingRepository;
import com.ai.booking.service.ScheduleLockScope.DayKey;
import com.ai.booking.utils.SlotCalculator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Availability and concurrency-safe booking. The local store decides; the
 * spreadsheet mirror is consulted before taking the lock and written after
 * commit.
 */
@Service
public class SlotAllocatorService {

    private static final Logger log = LoggerFactory.getLogger(SlotAllocatorService.class);
    private static final int MAX_CHANGE_ATTEMPTS = 3;

    private final BookingRepository bookingRepository;
    private final ScheduleLockScope lockScope;
    private final BookingMirror mirror;
    private final MirrorSyncService mirrorSyncService;
    private final BookingNotificationService notificationService;
    private final BookingProperties properties;

    public SlotAllocatorService(BookingRepository bookingRepository,
                                ScheduleLockScope lockScope,
                                BookingMirror mirror,
                                MirrorSyncService mirrorSyncService,
                                BookingNotificationService notificationService,
                                BookingProperties properties) {
        this.bookingRepository = bookingRepository;
        this.lockScope = lockScope;
        this.mirror = mirror;
        this.mirrorSyncService = mirrorSyncService;
        this.notificationService = notificationService;
        this.properties = properties;
    }

    public SortedSet<LocalTime> getAvailableSlots(String projectId, String specialist, LocalDate date, int durationSlots) {
        requireSpecialist(projectId, specialist);
        if (date == null) {
            throw new ValidationException("date is required");
        }
        if (durationSlots < 1) {
            throw new ValidationException("duration must be at least one slot");
        }
        int slotMinutes = properties.safeSlotMinutes();
        List<LocalTime> grid = grid(projectId);
        Set<LocalTime> occupied = SlotCalculator.occupied(activeBookings(projectId, specialist, date), slotMinutes);
        return SlotCalculator.available(grid, occupied, durationSlots, slotMinutes);
    }

    public Booking allocate(AllocationRequest request) {
        validateRange(request.projectId(), request.specialist(), request.date(), request.startTime(), request.durationSlots());
        if (StringUtils.isBlank(request.clientId())) {
            throw new ValidationException("client id is required");
        }
        int slotMinutes = properties.safeSlotMinutes();
        List<LocalTime> range = SlotCalculator.covered(request.startTime(), request.durationSlots(), slotMinutes);
        checkMirror(request.projectId(), request.specialist(), request.date(), request.startTime(), range, Set.of());

        DayKey day = new DayKey(request.specialist(), request.date());
        Booking saved = lockScope.withDayLock(request.projectId(), List.of(day), () -> {
            Set<LocalTime> occupied = SlotCalculator.occupied(
                    activeBookings(request.projectId(), request.specialist(), request.date()), slotMinutes);
            if (!SlotCalculator.fits(request.startTime(), request.durationSlots(), slotMinutes, grid(request.projectId()), occupied)) {
                throw new SlotConflictException(SlotConflictException.Source.LOCAL,
                        request.specialist(), request.date(), request.startTime());
            }
            return bookingRepository.save(Booking.builder()
                    .projectId(request.projectId())
                    .specialist(request.specialist())
                    .bookingDate(request.date())
                    .startTime(request.startTime())
                    .durationSlots(request.durationSlots())
                    .clientId(request.clientId())
                    .clientName(request.clientName())
                    .clientPhone(request.clientPhone())
                    .serviceName(request.serviceName())
                    .notes(request.notes())
                    .build());
        });

        log.info("Booked {} {} {} x{} for client {} (booking {})", saved.getSpecialist(), saved.getBookingDate(),
                saved.getStartTime(), saved.getDurationSlots(), saved.getClientId(), saved.getId());
        mirrorSyncService.pushBooking(saved.getId());
        notificationService.bookingCreated(saved);
        return saved;
    }

    /**
     * Cancels an active booking. Cancelling an already cancelled booking
     * returns it unchanged.
     */
    public Booking cancel(String projectId, Long bookingId) {
        for (int attempt = 1; ; attempt++) {
            Booking current = loadBooking(projectId, bookingId);
            if (!current.isActive()) {
                log.debug("Booking {} already cancelled", bookingId);
                return current;
            }
            DayKey day = new DayKey(current.getSpecialist(), current.getBookingDate());
            Optional<CancelledBooking> cancelled = lockScope.withDayLock(projectId, List.of(day), () -> {
                Booking locked = bookingRepository.findByIdForUpdate(bookingId)
                        .orElseThrow(() -> notFound(bookingId));
                if (!onDay(locked, day)) {
                    return Optional.empty();
                }
                boolean wasActive = locked.isActive();
                locked.setStatus(Booking.Status.CANCELLED);
                return Optional.of(new CancelledBooking(locked, wasActive));
            });
            if (cancelled.isPresent()) {
                Booking booking = cancelled.get().booking();
                if (cancelled.get().cancelledNow()) {
                    log.info("Cancelled booking {} ({} {} {})", bookingId, booking.getSpecialist(),
                            booking.getBookingDate(), booking.getStartTime());
                    mirrorSyncService.clearRange(MirrorRange.of(booking));
                    notificationService.bookingCancelled(booking);
                }
                return booking;
            }
            if (attempt >= MAX_CHANGE_ATTEMPTS) {
                throw new SlotConflictException(SlotConflictException.Source.LOCAL, day.specialist(), day.date(), current.getStartTime());
            }
            log.debug("Booking {} moved while cancelling, retrying", bookingId);
        }
    }

    public Booking change(ChangeRequest request) {
        int slotMinutes = properties.safeSlotMinutes();
        for (int attempt = 1; ; attempt++) {
            Booking current = loadBooking(request.projectId(), request.bookingId());
            if (!current.isActive()) {
                throw new BookingNotFoundException("Booking " + request.bookingId() + " is cancelled");
            }
            String specialist = StringUtils.defaultIfBlank(request.specialist(), current.getSpecialist());
            LocalDate date = request.date() != null ? request.date() : current.getBookingDate();
            LocalTime start = request.startTime() != null ? request.startTime() : current.getStartTime();
            int durationSlots = request.durationSlots() != null ? request.durationSlots() : current.getDurationSlots();
            validateRange(request.projectId(), specialist, date, start, durationSlots);

            DayKey oldDay = new DayKey(current.getSpecialist(), current.getBookingDate());
            DayKey newDay = new DayKey(specialist, date);
            Set<LocalTime> ownSlots = oldDay.equals(newDay)
                    ? Set.copyOf(SlotCalculator.covered(current.getStartTime(), current.getDurationSlots(), slotMinutes))
                    : Set.of();
            checkMirror(request.projectId(), specialist, date, start,
                    SlotCalculator.covered(start, durationSlots, slotMinutes), ownSlots);

            Optional<ChangedBooking> changed = lockScope.withDayLock(request.projectId(), List.of(oldDay, newDay), () -> {
                Booking locked = bookingRepository.findByIdForUpdate(request.bookingId())
                        .orElseThrow(() -> notFound(request.bookingId()));
                if (!locked.isActive()) {
                    throw new BookingNotFoundException("Booking " + request.bookingId() + " is cancelled");
                }
                if (!onDay(locked, oldDay)) {
                    return Optional.empty();
                }
                List<Booking> others = activeBookings(request.projectId(), specialist, date).stream()
                        .filter(b -> !b.getId().equals(locked.getId()))
                        .toList();
                Set<LocalTime> occupied = SlotCalculator.occupied(others, slotMinutes);
                if (!SlotCalculator.fits(start, durationSlots, slotMinutes, grid(request.projectId()), occupied)) {
                    throw new SlotConflictException(SlotConflictException.Source.LOCAL, specialist, date, start);
                }
                MirrorRange previous = MirrorRange.of(locked);
                locked.setSpecialist(specialist);
                locked.setBookingDate(date);
                locked.setStartTime(start);
                locked.setDurationSlots(durationSlots);
                if (StringUtils.isNotBlank(request.serviceName())) {
                    locked.setServiceName(request.serviceName());
                }
                locked.setMirrorState(Booking.MirrorState.PENDING);
                return Optional.of(new ChangedBooking(bookingRepository.saveAndFlush(locked), previous));
            });

            if (changed.isPresent()) {
                Booking booking = changed.get().booking();
                log.info("Changed booking {} from {} to {} {} {} x{}", booking.getId(), changed.get().previous(),
                        booking.getSpecialist(), booking.getBookingDate(), booking.getStartTime(), booking.getDurationSlots());
                mirrorSyncService.moveBooking(changed.get().previous(), booking.getId());
                notificationService.bookingChanged(booking);
                return booking;
            }
            if (attempt >= MAX_CHANGE_ATTEMPTS) {
                throw new SlotConflictException(SlotConflictException.Source.LOCAL, specialist, date, start);
            }
            log.debug("Booking {} moved while changing, retrying", request.bookingId());
        }
    }

    public List<Booking> findActiveBookings(String projectId, String clientId) {
        return bookingRepository.findByProjectIdAndClientIdAndStatusOrderByCreatedAtDesc(
                projectId, clientId, Booking.Status.ACTIVE);
    }

    public Map<String, Long> bookingStats(String projectId) {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total", bookingRepository.countByProjectId(projectId));
        stats.put("active", bookingRepository.countByProjectIdAndStatus(projectId, Booking.Status.ACTIVE));
        stats.put("cancelled", bookingRepository.countByProjectIdAndStatus(projectId, Booking.Status.CANCELLED));
        return stats;
    }

    /**
     * Slots needed for a named service; unknown services take one slot.
     */
    public int durationSlotsFor(String projectId, String serviceName) {
        if (StringUtils.isBlank(serviceName)) {
            return 1;
        }
        Map<String, Integer> services = properties.project(projectId)
                .map(BookingProperties.Project::safeServices)
                .orElse(Map.of());
        return services.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(serviceName.trim()))
                .findFirst()
                .map(e -> SlotCalculator.slotsForMinutes(e.getValue(), properties.safeSlotMinutes()))
                .orElse(1);
    }

    private void checkMirror(String projectId, String specialist, LocalDate date, LocalTime start,
                             List<LocalTime> range, Set<LocalTime> ownSlots) {
        if (!mirror.isEnabled(projectId)) {
            return;
        }
        Map<LocalTime, MirrorRecord> day;
        try {
            day = mirror.readDay(projectId, specialist, date);
        } catch (RuntimeException e) {
            log.warn("Mirror read failed for {} {}, local store decides: {}", specialist, date, e.getMessage());
            return;
        }
        for (LocalTime slot : range) {
            MirrorRecord record = day.get(slot);
            if (record != null && record.isOccupied() && !ownSlots.contains(slot)) {
                log.info("Slot {} {} {} occupied in mirror", specialist, date, slot);
                throw new SlotConflictException(SlotConflictException.Source.MIRROR, specialist, date, start);
            }
        }
    }

    private void validateRange(String projectId, String specialist, LocalDate date, LocalTime start, int durationSlots) {
        requireSpecialist(projectId, specialist);
        if (date == null || start == null) {
            throw new ValidationException("date and time are required");
        }
        if (date.isBefore(LocalDate.now())) {
            throw new ValidationException("date " + date + " is in the past");
        }
        if (durationSlots < 1) {
            throw new ValidationException("duration must be at least one slot");
        }
        List<LocalTime> grid = grid(projectId);
        if (!grid.contains(start)) {
            throw new ValidationException("time " + start + " is not a slot start within working hours");
        }
        if (!SlotCalculator.fits(start, durationSlots, properties.safeSlotMinutes(), grid, Set.of())) {
            throw new ValidationException("booking at " + start + " for " + durationSlots + " slots ends after working hours");
        }
    }

    private void requireSpecialist(String projectId, String specialist) {
        BookingProperties.Project project = properties.project(projectId)
                .orElseThrow(() -> new ValidationException("Unknown project: " + projectId));
        if (StringUtils.isBlank(specialist) || !project.safeSpecialists().contains(specialist)) {
            throw new ValidationException("Unknown specialist '" + specialist + "'. Available: "
                    + project.safeSpecialists().stream().collect(Collectors.joining(", ")));
        }
    }

    private Booking loadBooking(String projectId, Long bookingId) {
        if (bookingId == null) {
            throw new ValidationException("booking id is required");
        }
        return bookingRepository.findById(bookingId)
                .filter(b -> b.getProjectId().equals(projectId))
                .orElseThrow(() -> notFound(bookingId));
    }

    private List<Booking> activeBookings(String projectId, String specialist, LocalDate date) {
        return bookingRepository.findByProjectIdAndSpecialistAndBookingDateAndStatusOrderByStartTimeAsc(
                projectId, specialist, date, Booking.Status.ACTIVE);
    }

    private List<LocalTime> grid(String projectId) {
        return SlotCalculator.grid(properties.workStartFor(projectId), properties.workEndFor(projectId),
                properties.safeSlotMinutes());
    }

    private static boolean onDay(Booking booking, DayKey day) {
        return booking.getSpecialist().equals(day.specialist()) && booking.getBookingDate().equals(day.date());
    }

    private static BookingNotFoundException notFound(Long bookingId) {
        return new BookingNotFoundException("Booking not found: " + bookingId);
    }

    private record ChangedBooking(Booking booking, MirrorRange previous) {
    }

    private record CancelledBooking(Booking booking, boolean cancelledNow) {
    }
}
