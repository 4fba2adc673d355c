package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A notification waiting for delivery on one channel.
 *
 * Status transitions: PENDING → SENT, PENDING → FAILED after maxAttempts,
 * PENDING → CANCELLED.
 *
 * Database Table: notification_queue
 */
@Entity
@Table(name = "notification_queue", indexes = {
    @Index(name = "idx_notification_queue_user_id", columnList = "user_id"),
    @Index(name = "idx_notification_queue_status", columnList = "status"),
    @Index(name = "idx_notification_queue_scheduled_for", columnList = "scheduled_for")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationQueue {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "child_id")
    private UUID childId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 30)
    private NotificationType notificationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    private NotificationPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 20)
    private NotificationChannel channel;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "data_payload", columnDefinition = "jsonb")
    private Map<String, Object> dataPayload = new HashMap<>();

    @Column(name = "scheduled_for", nullable = false)
    private LocalDateTime scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private NotificationStatus status = NotificationStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private Integer attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void markSent(LocalDateTime now) {
        this.status = NotificationStatus.SENT;
        this.sentAt = now;
        this.errorMessage = null;
    }

    /**
     * Record a failed attempt; the entry becomes FAILED once attempts reach maxAttempts.
     */
    public void recordFailure(String error, LocalDateTime now) {
        this.errorMessage = error;
        this.lastAttemptAt = now;
        if (attempts >= maxAttempts) {
            this.status = NotificationStatus.FAILED;
        }
    }

    public enum NotificationType {
        STOCK_ALERT,
        DIAPER_CHANGE_REMINDER,
        EXPIRY_WARNING,
        HEALTH_TIP,
        SYSTEM_UPDATE,
        MARKETING
    }

    public enum NotificationPriority {
        CRITICAL,
        IMPORTANT,
        OPTIONAL
    }

    public enum NotificationChannel {
        PUSH,
        EMAIL,
        SMS,
        IN_APP
    }

    public enum NotificationStatus {
        PENDING,
        SENT,
        DELIVERED,
        FAILED,
        CANCELLED
    }
}
