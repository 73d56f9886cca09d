package com.ai.booking.dto;

import java.time.LocalDate;

/**
 * Counts of what one reconciliation pass over a specialist's day did.
 */
public record ReconcileReport(
        String projectId,
        String specialist,
        LocalDate date,
        int repushed,
        int cancelled,
        int updated,
        int imported,
        int skipped
) {

    public static ReconcileReport untouched(String projectId, String specialist, LocalDate date) {
        return new ReconcileReport(projectId, specialist, date, 0, 0, 0, 0, 0);
    }

    public boolean hasChanges() {
        return repushed + cancelled + updated + imported + skipped > 0;
    }
}
