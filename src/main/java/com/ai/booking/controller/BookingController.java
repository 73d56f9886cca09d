package com.ai.booking.controller;

import com.ai.booking.dto.AllocationRequest;
import com.ai.booking.dto.BookingRequest;
import com.ai.booking.dto.BookingResponse;
import com.ai.booking.dto.ChangeRequest;
import com.ai.booking.entity.Booking;
import com.ai.booking.exception.ValidationException;
import com.ai.booking.service.SlotAllocatorService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/projects/{projectId}")
public class BookingController {

    private final SlotAllocatorService allocator;

    public BookingController(SlotAllocatorService allocator) {
        this.allocator = allocator;
    }

    @GetMapping("/slots")
    public Map<String, Object> slots(@PathVariable String projectId,
                                     @RequestParam String specialist,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                     @RequestParam(required = false) Integer duration,
                                     @RequestParam(required = false) String service) {
        int slots = duration != null ? duration : allocator.durationSlotsFor(projectId, service);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("specialist", specialist);
        body.put("date", date.toString());
        body.put("duration_slots", slots);
        body.put("slots", allocator.getAvailableSlots(projectId, specialist, date, slots).stream()
                .map(LocalTime::toString)
                .toList());
        return body;
    }

    @PostMapping("/bookings")
    @ResponseStatus(HttpStatus.CREATED)
    public BookingResponse create(@PathVariable String projectId, @RequestBody BookingRequest request) {
        if (StringUtils.isBlank(request.clientId())) {
            throw new ValidationException("client_id is required");
        }
        int slots = request.durationSlots() != null
                ? request.durationSlots()
                : allocator.durationSlotsFor(projectId, request.service());
        Booking booking = allocator.allocate(new AllocationRequest(projectId, request.specialist(), request.date(),
                request.time(), slots, request.clientId(), request.clientName(), request.clientPhone(),
                request.service(), request.notes()));
        return BookingResponse.from(booking);
    }

    @PutMapping("/bookings/{id}")
    public BookingResponse change(@PathVariable String projectId, @PathVariable Long id,
                                  @RequestBody BookingRequest request) {
        Integer slots = request.durationSlots();
        if (slots == null && StringUtils.isNotBlank(request.service())) {
            slots = allocator.durationSlotsFor(projectId, request.service());
        }
        Booking booking = allocator.change(new ChangeRequest(projectId, id, request.specialist(), request.date(),
                request.time(), slots, request.service()));
        return BookingResponse.from(booking);
    }

    @DeleteMapping("/bookings/{id}")
    public BookingResponse cancel(@PathVariable String projectId, @PathVariable Long id) {
        return BookingResponse.from(allocator.cancel(projectId, id));
    }

    @GetMapping("/clients/{clientId}/bookings")
    public List<BookingResponse> clientBookings(@PathVariable String projectId, @PathVariable String clientId) {
        return allocator.findActiveBookings(projectId, clientId).stream().map(BookingResponse::from).toList();
    }
}
