package ca.nestsync.dto.response;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * One logged change on a daily timeline, in the caller's local time.
 */
public record UsageEvent(
        LocalDateTime timestamp,
        int quantity,
        int hourOfDay,
        DayOfWeek dayOfWeek,
        boolean wasWet,
        boolean wasSoiled,
        Integer timeSinceLastMinutes
) {
}
