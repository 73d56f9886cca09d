package com.ai.booking.mirror;

import com.ai.booking.entity.Booking;
import org.apache.commons.lang3.StringUtils;

/**
 * One slot row as the spreadsheet shows it. Rows after the first of a
 * multi-slot booking carry only the continuation marker.
 */
public record MirrorRecord(String clientId, String clientName, String serviceName, boolean continuation) {

    public static final String CONTINUATION_MARKER = "-";

    public static MirrorRecord of(Booking booking) {
        return new MirrorRecord(booking.getClientId(), booking.getClientName(), booking.getServiceName(), false);
    }

    public static MirrorRecord continuationRow() {
        return new MirrorRecord(CONTINUATION_MARKER, CONTINUATION_MARKER, CONTINUATION_MARKER, true);
    }

    /**
     * Builds a record from raw cell values; {@code null} for an empty row.
     */
    public static MirrorRecord fromCells(String clientId, String clientName, String serviceName) {
        String id = StringUtils.trimToEmpty(clientId);
        if (id.isEmpty()) {
            return null;
        }
        if (CONTINUATION_MARKER.equals(id)) {
            return continuationRow();
        }
        return new MirrorRecord(id, StringUtils.trimToNull(clientName), StringUtils.trimToNull(serviceName), false);
    }

    public boolean isOccupied() {
        return continuation || StringUtils.isNotBlank(clientId);
    }

    /** Client and service fields differ from the booking's. */
    public boolean differsFrom(Booking booking) {
        return !StringUtils.equals(clientId, booking.getClientId())
                || !StringUtils.equals(StringUtils.trimToNull(clientName), StringUtils.trimToNull(booking.getClientName()))
                || !StringUtils.equals(StringUtils.trimToNull(serviceName), StringUtils.trimToNull(booking.getServiceName()));
    }
}
