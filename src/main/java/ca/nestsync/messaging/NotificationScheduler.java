package ca.nestsync.messaging;

import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationStatus;
import ca.nestsync.repository.NotificationQueueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Republishes PENDING entries whose {@code scheduledFor} has passed: scheduled
 * notifications, entries deferred by quiet hours, and entries whose first
 * publish or delivery attempt failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationScheduler {

    private final NotificationQueueRepository queueRepository;
    private final NotificationDeliveryProducer producer;

    @Scheduled(fixedDelayString = "${app.notifications.sweep-interval-ms:60000}")
    public void publishDueNotifications() {
        List<NotificationQueue> due = queueRepository.findByStatusAndScheduledForLessThanEqual(
                NotificationStatus.PENDING, LocalDateTime.now(ZoneOffset.UTC));
        if (due.isEmpty()) {
            return;
        }

        log.info("Republishing {} due notification(s)", due.size());
        for (NotificationQueue entry : due) {
            try {
                producer.sendDeliveryTask(entry.getId());
            } catch (AmqpException e) {
                log.error("Broker unavailable; {} notification(s) left for the next sweep", due.size(), e);
                return;
            }
        }
    }
}
