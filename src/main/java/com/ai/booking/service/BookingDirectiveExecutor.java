package com.ai.booking.service;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.dto.AllocationRequest;
import com.ai.booking.dto.ChangeRequest;
import com.ai.booking.dto.DirectiveOutcome;
import com.ai.booking.dto.TurnDecision;
import com.ai.booking.entity.Booking;
import com.ai.booking.exception.BookingNotFoundException;
import com.ai.booking.exception.SlotConflictException;
import com.ai.booking.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Carries out the booking action a turn decided on through the allocator.
 * Business refusals come back as a failed {@link DirectiveOutcome}; anything
 * else propagates and fails the turn.
 */
@Component
public class BookingDirectiveExecutor {

    private static final Logger log = LoggerFactory.getLogger(BookingDirectiveExecutor.class);

    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("d.M.yyyy");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DATE_OUT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final SlotAllocatorService allocator;
    private final BookingProperties properties;

    public BookingDirectiveExecutor(SlotAllocatorService allocator, BookingProperties properties) {
        this.allocator = allocator;
        this.properties = properties;
    }

    public DirectiveOutcome execute(String projectId, String clientId, TurnDecision decision) {
        TurnDecision.Action action = decision.actionType();
        try {
            return switch (action) {
                case NONE -> DirectiveOutcome.none();
                case ACTIVATE -> activate(projectId, clientId, decision);
                case REJECT -> reject(projectId, clientId, decision);
                case CHANGE -> change(projectId, clientId, decision);
            };
        } catch (SlotConflictException e) {
            log.info("{} for {}/{} refused: {}", action, projectId, clientId, e.getMessage());
            return DirectiveOutcome.failure(action, "Sorry, " + e.getDate().format(DATE_OUT) + " " + e.getStartTime()
                    + " is already taken. Please choose another time.");
        } catch (ValidationException e) {
            log.info("{} for {}/{} invalid: {}", action, projectId, clientId, e.getMessage());
            return DirectiveOutcome.failure(action, "I could not do that: " + e.getMessage());
        } catch (BookingNotFoundException e) {
            log.info("{} for {}/{}: {}", action, projectId, clientId, e.getMessage());
            return DirectiveOutcome.failure(action, "I could not find that booking.");
        }
    }

    private DirectiveOutcome activate(String projectId, String clientId, TurnDecision decision) {
        String specialist = resolveSpecialist(projectId, decision.specialist());
        LocalDate date = parseDate(decision.date());
        LocalTime time = parseTime(decision.time());
        int slots = allocator.durationSlotsFor(projectId, decision.service());
        Booking booking = allocator.allocate(new AllocationRequest(projectId, specialist, date, time, slots,
                clientId, decision.clientName(), decision.phone(), decision.service(), null));
        return DirectiveOutcome.success(TurnDecision.Action.ACTIVATE,
                "Booked: " + specialist + ", " + date.format(DATE_OUT) + " " + time, booking.getId());
    }

    private DirectiveOutcome reject(String projectId, String clientId, TurnDecision decision) {
        String dateText = StringUtils.defaultIfBlank(decision.oldDate(), decision.date());
        String timeText = StringUtils.defaultIfBlank(decision.oldTime(), decision.time());
        Booking target = findTarget(projectId, clientId, decision.specialist(), dateText, timeText, null)
                .orElseThrow(() -> new BookingNotFoundException("No matching active booking for " + clientId));
        Booking cancelled = allocator.cancel(projectId, target.getId());
        return DirectiveOutcome.success(TurnDecision.Action.REJECT,
                "Cancelled: " + cancelled.getSpecialist() + ", " + cancelled.getBookingDate().format(DATE_OUT)
                        + " " + cancelled.getStartTime(), cancelled.getId());
    }

    private DirectiveOutcome change(String projectId, String clientId, TurnDecision decision) {
        Booking target = findTarget(projectId, clientId, null, decision.oldDate(), decision.oldTime(), decision.service())
                .orElseThrow(() -> new BookingNotFoundException("No active booking to change for " + clientId));
        String specialist = StringUtils.isBlank(decision.specialist()) ? null : resolveSpecialist(projectId, decision.specialist());
        LocalDate date = StringUtils.isBlank(decision.date()) ? null : parseDate(decision.date());
        LocalTime time = StringUtils.isBlank(decision.time()) ? null : parseTime(decision.time());
        Integer slots = StringUtils.isBlank(decision.service()) ? null : allocator.durationSlotsFor(projectId, decision.service());
        Booking changed = allocator.change(new ChangeRequest(projectId, target.getId(), specialist, date, time, slots,
                decision.service()));
        return DirectiveOutcome.success(TurnDecision.Action.CHANGE,
                "Moved to: " + changed.getSpecialist() + ", " + changed.getBookingDate().format(DATE_OUT)
                        + " " + changed.getStartTime(), changed.getId());
    }

    /**
     * Picks the client's booking a cancel or change refers to: by date and
     * time when given, then by service, else the most recently made one.
     */
    private Optional<Booking> findTarget(String projectId, String clientId, String specialist,
                                         String dateText, String timeText, String service) {
        List<Booking> active = allocator.findActiveBookings(projectId, clientId);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        if (StringUtils.isNotBlank(dateText)) {
            LocalDate date = parseDate(dateText);
            LocalTime time = StringUtils.isBlank(timeText) ? null : parseTime(timeText);
            return active.stream()
                    .filter(b -> b.getBookingDate().equals(date))
                    .filter(b -> time == null || b.getStartTime().equals(time))
                    .filter(b -> StringUtils.isBlank(specialist) || b.getSpecialist().equalsIgnoreCase(specialist.trim()))
                    .findFirst();
        }
        if (StringUtils.isNotBlank(service)) {
            Optional<Booking> byService = active.stream()
                    .filter(b -> service.trim().equalsIgnoreCase(StringUtils.trimToEmpty(b.getServiceName())))
                    .findFirst();
            if (byService.isPresent()) {
                return byService;
            }
        }
        return Optional.of(active.get(0));
    }

    private String resolveSpecialist(String projectId, String requested) {
        List<String> specialists = properties.project(projectId)
                .map(BookingProperties.Project::safeSpecialists)
                .orElse(List.of());
        if (StringUtils.isBlank(requested)) {
            if (specialists.size() == 1) {
                return specialists.get(0);
            }
            throw new ValidationException("specialist is required");
        }
        return specialists.stream()
                .filter(s -> s.equalsIgnoreCase(requested.trim()))
                .findFirst()
                .orElse(requested.trim());
    }

    /** Accepts dd.MM.yyyy, yyyy-MM-dd and dd.MM (this year, or next if already past). */
    static LocalDate parseDate(String value) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException("date is required");
        }
        String text = value.trim();
        try {
            if (text.matches("\\d{4}-\\d{2}-\\d{2}")) {
                return LocalDate.parse(text);
            }
            if (text.matches("\\d{1,2}\\.\\d{1,2}")) {
                LocalDate today = LocalDate.now();
                LocalDate date = LocalDate.parse(text + "." + today.getYear(), DAY_MONTH_YEAR);
                return date.isBefore(today) ? date.plusYears(1) : date;
            }
            return LocalDate.parse(text, DAY_MONTH_YEAR);
        } catch (DateTimeParseException e) {
            throw new ValidationException("unrecognised date '" + text + "'");
        }
    }

    static LocalTime parseTime(String value) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException("time is required");
        }
        try {
            return LocalTime.parse(value.trim(), TIME);
        } catch (DateTimeParseException e) {
            throw new ValidationException("unrecognised time '" + value.trim() + "'");
        }
    }
}
