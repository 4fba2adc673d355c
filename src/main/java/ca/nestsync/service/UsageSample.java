package ca.nestsync.service;

import ca.nestsync.entity.UsageLog;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * A usage log as the analytics see it: local time in the caller's timezone,
 * missing flags read as false.
 */
record UsageSample(LocalDateTime localTime, int quantity, boolean wet, boolean soiled,
                   Integer minutesSinceLast, UUID inventoryItemId) {

    static UsageSample of(UsageLog log, ZoneId zone) {
        LocalDateTime local = log.getLoggedAt().atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDateTime();
        return new UsageSample(
                local,
                log.getQuantityUsed() != null ? log.getQuantityUsed() : 1,
                Boolean.TRUE.equals(log.getWasWet()),
                Boolean.TRUE.equals(log.getWasSoiled()),
                log.getTimeSinceLastChange(),
                log.getInventoryItemId());
    }

    LocalDate date() {
        return localTime.toLocalDate();
    }

    int hour() {
        return localTime.getHour();
    }

    DayOfWeek dayOfWeek() {
        return localTime.getDayOfWeek();
    }

    boolean hasInterval() {
        return minutesSinceLast != null && minutesSinceLast > 0;
    }
}
