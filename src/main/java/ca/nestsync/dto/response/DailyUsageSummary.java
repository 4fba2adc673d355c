package ca.nestsync.dto.response;

import java.time.LocalDate;

/**
 * Counts for one calendar day. averageIntervalMinutes is null when no change
 * that day recorded the time since the previous one.
 */
public record DailyUsageSummary(
        LocalDate date,
        int totalChanges,
        int wetOnly,
        int soiledOnly,
        int wetAndSoiled,
        int dryChanges,
        int totalQuantity,
        Double averageIntervalMinutes
) {
}
