package ca.nestsync.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial preferences update; null fields are left unchanged.
 *
 * Quiet hours are HH:mm in the user's timezone.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNotificationPreferencesInput {

    private Boolean notificationsEnabled;
    private Boolean criticalNotifications;
    private Boolean importantNotifications;
    private Boolean optionalNotifications;
    private Boolean pushNotifications;
    private Boolean emailNotifications;
    private Boolean smsNotifications;
    private Boolean quietHoursEnabled;
    private String quietHoursStart;
    private String quietHoursEnd;
    private Boolean stockAlertEnabled;
    private Integer stockAlertThreshold;
    private Boolean changeReminderEnabled;
    private Integer changeReminderIntervalHours;
    private Boolean expiryWarningEnabled;
    private Integer expiryWarningDays;
    private Boolean healthTipsEnabled;
    private Boolean marketingEnabled;
    private String userTimezone;
    private Integer dailyNotificationLimit;
    private Boolean notificationConsentGranted;
    private Boolean marketingConsentGranted;
}
