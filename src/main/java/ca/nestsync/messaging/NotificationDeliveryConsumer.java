package ca.nestsync.messaging;

import ca.nestsync.entity.NotificationDeliveryLog;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationStatus;
import ca.nestsync.repository.NotificationDeliveryLogRepository;
import ca.nestsync.repository.NotificationQueueRepository;
import ca.nestsync.service.NotificationPreferenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Delivers queued notifications received from RabbitMQ.
 *
 * Processing Flow:
 * 1. Receive the queue entry id
 * 2. Skip entries that are missing, no longer PENDING, or not yet due
 * 3. Defer non-critical entries that fall in the user's quiet hours
 * 4. Dispatch on the entry's channel and write a delivery log row
 * 5. On failure record the attempt; after max attempts the entry is FAILED
 *
 * Deferred entries stay PENDING with a later {@code scheduledFor} and are
 * republished by {@link NotificationScheduler}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationDeliveryConsumer {

    private static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Toronto");

    private final NotificationQueueRepository queueRepository;
    private final NotificationDeliveryLogRepository deliveryLogRepository;
    private final NotificationPreferenceService preferenceService;
    private final NotificationDispatcher dispatcher;

    @RabbitListener(queues = "${app.rabbitmq.queue.notification.delivery:notification.delivery.queue}")
    @Transactional
    public void deliver(UUID queueEntryId) {
        log.info("Received notification delivery task: queueEntryId={}", queueEntryId);

        if (queueEntryId == null) {
            log.error("Received null notification queue id");
            return;
        }

        NotificationQueue entry = queueRepository.findById(queueEntryId).orElse(null);
        if (entry == null) {
            log.warn("Notification queue entry not found: {}", queueEntryId);
            return;
        }
        if (entry.getStatus() != NotificationStatus.PENDING) {
            log.debug("Skipping notification {} in status {}", queueEntryId, entry.getStatus());
            return;
        }

        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        if (entry.getScheduledFor() != null && entry.getScheduledFor().isAfter(now)) {
            log.debug("Notification {} not due until {}", queueEntryId, entry.getScheduledFor());
            return;
        }

        NotificationPreferences prefs = preferenceService.getOrCreate(entry.getUserId());
        ZoneId zone = zoneOf(prefs);
        ZonedDateTime localNow = now.atZone(ZoneOffset.UTC).withZoneSameInstant(zone);
        if (entry.getPriority() != NotificationPriority.CRITICAL && prefs.isInQuietHours(localNow.toLocalTime())) {
            LocalDateTime deferredTo = quietHoursEnd(localNow, prefs);
            entry.setScheduledFor(deferredTo);
            queueRepository.save(entry);
            log.info("Notification {} deferred by quiet hours until {} UTC", queueEntryId, deferredTo);
            return;
        }

        entry.setAttempts(entry.getAttempts() + 1);
        entry.setLastAttemptAt(now);
        try {
            String externalId = dispatcher.dispatch(entry, prefs);
            entry.markSent(now);
            queueRepository.save(entry);
            deliveryLogRepository.save(NotificationDeliveryLog.fromQueue(entry, externalId, now));
            log.info("Notification {} sent on {} (attempt {})", queueEntryId, entry.getChannel(), entry.getAttempts());
        } catch (RuntimeException e) {
            entry.recordFailure(e.getMessage(), now);
            queueRepository.save(entry);
            if (entry.getStatus() == NotificationStatus.FAILED) {
                log.error("Notification {} failed permanently after {} attempts: {}",
                        queueEntryId, entry.getAttempts(), e.getMessage());
            } else {
                log.warn("Notification {} delivery attempt {}/{} failed: {}",
                        queueEntryId, entry.getAttempts(), entry.getMaxAttempts(), e.getMessage());
            }
        }
    }

    /**
     * Next end of quiet hours after the given local time, in UTC.
     */
    static LocalDateTime quietHoursEnd(ZonedDateTime localNow, NotificationPreferences prefs) {
        ZonedDateTime end = localNow.with(prefs.getQuietHoursEnd()).withSecond(0).withNano(0);
        if (!end.isAfter(localNow)) {
            end = end.plusDays(1);
        }
        return end.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    private ZoneId zoneOf(NotificationPreferences prefs) {
        if (prefs.getUserTimezone() == null) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(prefs.getUserTimezone());
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}' for user {}; using America/Toronto", prefs.getUserTimezone(), prefs.getUserId());
            return DEFAULT_ZONE;
        }
    }
}
