package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Record of a delivered notification and the user's interaction with it.
 *
 * Database Table: notification_delivery_log
 */
@Entity
@Table(name = "notification_delivery_log", indexes = {
    @Index(name = "idx_delivery_log_user_id", columnList = "user_id"),
    @Index(name = "idx_delivery_log_queue_id", columnList = "queue_id"),
    @Index(name = "idx_delivery_log_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDeliveryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "queue_id")
    private UUID queueId;

    @Column(name = "child_id")
    private UUID childId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 30)
    private NotificationQueue.NotificationType notificationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 20)
    private NotificationQueue.NotificationChannel channel;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private NotificationQueue.NotificationStatus status;

    @Column(name = "external_id", length = 200)
    private String externalId;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "clicked_at")
    private LocalDateTime clickedAt;

    @Column(name = "dismissed_at")
    private LocalDateTime dismissedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static NotificationDeliveryLog fromQueue(NotificationQueue entry, String externalId, LocalDateTime now) {
        NotificationDeliveryLog log = new NotificationDeliveryLog();
        log.setUserId(entry.getUserId());
        log.setQueueId(entry.getId());
        log.setChildId(entry.getChildId());
        log.setNotificationType(entry.getNotificationType());
        log.setChannel(entry.getChannel());
        log.setTitle(entry.getTitle());
        log.setMessage(entry.getMessage());
        log.setStatus(NotificationQueue.NotificationStatus.SENT);
        log.setExternalId(externalId);
        log.setDeliveredAt(now);
        return log;
    }
}
