package com.ai.booking.service;

import com.ai.booking.config.BookingProperties;
import com.ai.booking.entity.Booking;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Texts the project's administrators when a booking is created, changed or
 * cancelled. Fire and forget.
 */
@Service
public class BookingNotificationService {

    private static final Logger log = LoggerFactory.getLogger(BookingNotificationService.class);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final TwilioService twilioService;
    private final BookingProperties properties;
    private final Executor executor;

    public BookingNotificationService(TwilioService twilioService,
                                      BookingProperties properties,
                                      @Qualifier("mirrorExecutor") Executor executor) {
        this.twilioService = twilioService;
        this.properties = properties;
        this.executor = executor;
    }

    public void bookingCreated(Booking booking) {
        notifyAdmins("New booking", booking);
    }

    public void bookingChanged(Booking booking) {
        notifyAdmins("Booking changed", booking);
    }

    public void bookingCancelled(Booking booking) {
        notifyAdmins("Booking cancelled", booking);
    }

    private void notifyAdmins(String title, Booking booking) {
        List<String> phones = properties.safeAdminPhones();
        if (phones.isEmpty()) {
            return;
        }
        String text = format(title, booking);
        try {
            executor.execute(() -> {
                for (String phone : phones) {
                    if (!twilioService.sendSms(phone, text)) {
                        log.warn("Admin notification to {} not sent for booking {}", phone, booking.getId());
                    }
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Admin notification for booking {} dropped: {}", booking.getId(), e.getMessage());
        }
    }

    static String format(String title, Booking booking) {
        StringBuilder sb = new StringBuilder(title).append(": ")
                .append(booking.getSpecialist()).append(", ")
                .append(booking.getBookingDate().format(DATE)).append(' ')
                .append(booking.getStartTime());
        if (StringUtils.isNotBlank(booking.getServiceName())) {
            sb.append(", ").append(booking.getServiceName());
        }
        sb.append(", client ").append(StringUtils.defaultIfBlank(booking.getClientName(), booking.getClientId()));
        if (StringUtils.isNotBlank(booking.getClientPhone())) {
            sb.append(" (").append(booking.getClientPhone()).append(')');
        }
        return sb.toString();
    }
}
