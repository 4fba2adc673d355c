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
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Per-user notification settings. One row per user, created with defaults on first read.
 *
 * Database Table: notification_preferences
 */
@Entity
@Table(name = "notification_preferences", indexes = {
    @Index(name = "idx_notification_prefs_user_id", columnList = "user_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "notifications_enabled", nullable = false)
    private Boolean notificationsEnabled = true;

    @Column(name = "critical_notifications", nullable = false)
    private Boolean criticalNotifications = true;

    @Column(name = "important_notifications", nullable = false)
    private Boolean importantNotifications = true;

    @Column(name = "optional_notifications", nullable = false)
    private Boolean optionalNotifications = false;

    @Column(name = "push_notifications", nullable = false)
    private Boolean pushNotifications = true;

    @Column(name = "email_notifications", nullable = false)
    private Boolean emailNotifications = true;

    @Column(name = "sms_notifications", nullable = false)
    private Boolean smsNotifications = false;

    @Column(name = "quiet_hours_enabled", nullable = false)
    private Boolean quietHoursEnabled = true;

    @Column(name = "quiet_hours_start", nullable = false)
    private LocalTime quietHoursStart = LocalTime.of(22, 0);

    @Column(name = "quiet_hours_end", nullable = false)
    private LocalTime quietHoursEnd = LocalTime.of(8, 0);

    @Column(name = "stock_alert_enabled", nullable = false)
    private Boolean stockAlertEnabled = true;

    @Column(name = "stock_alert_threshold", nullable = false)
    private Integer stockAlertThreshold = 3;

    @Column(name = "change_reminder_enabled", nullable = false)
    private Boolean changeReminderEnabled = false;

    @Column(name = "change_reminder_interval_hours", nullable = false)
    private Integer changeReminderIntervalHours = 4;

    @Column(name = "expiry_warning_enabled", nullable = false)
    private Boolean expiryWarningEnabled = true;

    @Column(name = "expiry_warning_days", nullable = false)
    private Integer expiryWarningDays = 7;

    @Column(name = "health_tips_enabled", nullable = false)
    private Boolean healthTipsEnabled = false;

    @Column(name = "marketing_enabled", nullable = false)
    private Boolean marketingEnabled = false;

    @Column(name = "user_timezone", nullable = false, length = 50)
    private String userTimezone = "America/Toronto";

    @Column(name = "daily_notification_limit", nullable = false)
    private Integer dailyNotificationLimit = 10;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_tokens", columnDefinition = "jsonb")
    private List<DeviceToken> deviceTokens = new ArrayList<>();

    @Column(name = "notification_consent_granted", nullable = false)
    private Boolean notificationConsentGranted = false;

    @Column(name = "notification_consent_date")
    private LocalDateTime notificationConsentDate;

    @Column(name = "marketing_consent_granted", nullable = false)
    private Boolean marketingConsentGranted = false;

    @Column(name = "marketing_consent_date")
    private LocalDateTime marketingConsentDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public NotificationPreferences(UUID userId) {
        this.userId = userId;
    }

    /**
     * Whether the given local time falls inside quiet hours. Handles windows
     * that wrap past midnight (22:00 to 08:00). Equal start and end is an empty window.
     */
    public boolean isInQuietHours(LocalTime localTime) {
        if (!Boolean.TRUE.equals(quietHoursEnabled) || quietHoursStart == null || quietHoursEnd == null
                || quietHoursStart.equals(quietHoursEnd)) {
            return false;
        }
        if (quietHoursStart.isBefore(quietHoursEnd)) {
            return !localTime.isBefore(quietHoursStart) && localTime.isBefore(quietHoursEnd);
        }
        return !localTime.isBefore(quietHoursStart) || localTime.isBefore(quietHoursEnd);
    }

    public boolean isPriorityEnabled(NotificationQueue.NotificationPriority priority) {
        switch (priority) {
            case CRITICAL:
                return Boolean.TRUE.equals(criticalNotifications);
            case IMPORTANT:
                return Boolean.TRUE.equals(importantNotifications);
            default:
                return Boolean.TRUE.equals(optionalNotifications);
        }
    }

    public boolean isChannelEnabled(NotificationQueue.NotificationChannel channel) {
        switch (channel) {
            case PUSH:
                return Boolean.TRUE.equals(pushNotifications);
            case EMAIL:
                return Boolean.TRUE.equals(emailNotifications);
            case SMS:
                return Boolean.TRUE.equals(smsNotifications);
            default:
                return true;
        }
    }

    /**
     * Registered push target. Stored inside the device_tokens JSON column.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceToken {
        private String token;
        private String platform;
        private String registeredAt;
    }
}
