package ca.nestsync.service;

import ca.nestsync.dto.request.UpdateNotificationPreferencesInput;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationPreferences.DeviceToken;
import ca.nestsync.repository.NotificationPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Reads and updates per-user notification preferences, including the
 * notification and marketing consent flags and registered push tokens.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationPreferenceService {

    static final Set<String> PLATFORMS = Set.of("ios", "android", "web");
    static final int MAX_DEVICE_TOKENS = 5;
    static final int MIN_TOKEN_LENGTH = 10;
    private static final DateTimeFormatter QUIET_HOURS_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final NotificationPreferencesRepository preferencesRepository;

    /**
     * Preferences of a user, created with defaults on first read.
     */
    @Transactional
    public NotificationPreferences getOrCreate(UUID userId) {
        return preferencesRepository.findByUserId(userId)
                .orElseGet(() -> {
                    log.info("Creating default notification preferences for user {}", userId);
                    return preferencesRepository.save(new NotificationPreferences(userId));
                });
    }

    @Transactional
    public NotificationPreferences update(UUID userId, UpdateNotificationPreferencesInput input) {
        NotificationPreferences prefs = getOrCreate(userId);

        if (input.getNotificationsEnabled() != null) {
            prefs.setNotificationsEnabled(input.getNotificationsEnabled());
        }
        if (input.getCriticalNotifications() != null) {
            prefs.setCriticalNotifications(input.getCriticalNotifications());
        }
        if (input.getImportantNotifications() != null) {
            prefs.setImportantNotifications(input.getImportantNotifications());
        }
        if (input.getOptionalNotifications() != null) {
            prefs.setOptionalNotifications(input.getOptionalNotifications());
        }
        if (input.getPushNotifications() != null) {
            prefs.setPushNotifications(input.getPushNotifications());
        }
        if (input.getEmailNotifications() != null) {
            prefs.setEmailNotifications(input.getEmailNotifications());
        }
        if (input.getSmsNotifications() != null) {
            prefs.setSmsNotifications(input.getSmsNotifications());
        }
        if (input.getQuietHoursEnabled() != null) {
            prefs.setQuietHoursEnabled(input.getQuietHoursEnabled());
        }
        if (input.getQuietHoursStart() != null) {
            prefs.setQuietHoursStart(parseTime(input.getQuietHoursStart()));
        }
        if (input.getQuietHoursEnd() != null) {
            prefs.setQuietHoursEnd(parseTime(input.getQuietHoursEnd()));
        }
        if (prefs.getQuietHoursStart() != null && prefs.getQuietHoursStart().equals(prefs.getQuietHoursEnd())) {
            throw new IllegalArgumentException("Quiet hours start and end must be different times");
        }
        if (input.getStockAlertEnabled() != null) {
            prefs.setStockAlertEnabled(input.getStockAlertEnabled());
        }
        if (input.getStockAlertThreshold() != null) {
            requireRange(input.getStockAlertThreshold(), 1, 30, "Stock alert threshold must be between 1 and 30 days");
            prefs.setStockAlertThreshold(input.getStockAlertThreshold());
        }
        if (input.getChangeReminderEnabled() != null) {
            prefs.setChangeReminderEnabled(input.getChangeReminderEnabled());
        }
        if (input.getChangeReminderIntervalHours() != null) {
            requireRange(input.getChangeReminderIntervalHours(), 1, 12, "Change reminder interval must be between 1 and 12 hours");
            prefs.setChangeReminderIntervalHours(input.getChangeReminderIntervalHours());
        }
        if (input.getExpiryWarningEnabled() != null) {
            prefs.setExpiryWarningEnabled(input.getExpiryWarningEnabled());
        }
        if (input.getExpiryWarningDays() != null) {
            requireRange(input.getExpiryWarningDays(), 1, 90, "Expiry warning days must be between 1 and 90");
            prefs.setExpiryWarningDays(input.getExpiryWarningDays());
        }
        if (input.getHealthTipsEnabled() != null) {
            prefs.setHealthTipsEnabled(input.getHealthTipsEnabled());
        }
        if (input.getMarketingEnabled() != null) {
            prefs.setMarketingEnabled(input.getMarketingEnabled());
        }
        if (input.getUserTimezone() != null) {
            prefs.setUserTimezone(validateTimezone(input.getUserTimezone()));
        }
        if (input.getDailyNotificationLimit() != null) {
            requireRange(input.getDailyNotificationLimit(), 1, 50, "Daily notification limit must be between 1 and 50");
            prefs.setDailyNotificationLimit(input.getDailyNotificationLimit());
        }

        applyConsent(prefs, input, LocalDateTime.now(ZoneOffset.UTC));

        log.info("Notification preferences updated for user {}", userId);
        return preferencesRepository.save(prefs);
    }

    /**
     * Register a push token. An existing entry with the same token is replaced
     * and only the most recent tokens are kept.
     */
    @Transactional
    public NotificationPreferences registerDeviceToken(UUID userId, String token, String platform) {
        if (platform == null || !PLATFORMS.contains(platform)) {
            throw new IllegalArgumentException("Platform must be 'ios', 'android', or 'web'");
        }
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            throw new IllegalArgumentException("Invalid device token format");
        }

        NotificationPreferences prefs = getOrCreate(userId);
        List<DeviceToken> tokens = new ArrayList<>();
        if (prefs.getDeviceTokens() != null) {
            prefs.getDeviceTokens().stream()
                    .filter(existing -> !token.equals(existing.getToken()))
                    .forEach(tokens::add);
        }
        tokens.add(new DeviceToken(token, platform, LocalDateTime.now(ZoneOffset.UTC).toString()));
        if (tokens.size() > MAX_DEVICE_TOKENS) {
            tokens = new ArrayList<>(tokens.subList(tokens.size() - MAX_DEVICE_TOKENS, tokens.size()));
        }
        prefs.setDeviceTokens(tokens);

        log.info("Registered {} device token for user {}", platform, userId);
        return preferencesRepository.save(prefs);
    }

    private void applyConsent(NotificationPreferences prefs, UpdateNotificationPreferencesInput input, LocalDateTime now) {
        Boolean notificationConsent = input.getNotificationConsentGranted();
        if (notificationConsent != null) {
            boolean current = Boolean.TRUE.equals(prefs.getNotificationConsentGranted());
            if (notificationConsent && !current) {
                prefs.setNotificationConsentGranted(true);
                prefs.setNotificationConsentDate(now);
                log.info("User {} granted notification consent", prefs.getUserId());
            } else if (!notificationConsent && current) {
                prefs.setNotificationConsentGranted(false);
                prefs.setNotificationConsentDate(null);
                prefs.setNotificationsEnabled(false);
                log.info("User {} withdrew notification consent; notifications disabled", prefs.getUserId());
            }
        }

        Boolean marketingConsent = input.getMarketingConsentGranted();
        if (marketingConsent != null) {
            boolean current = Boolean.TRUE.equals(prefs.getMarketingConsentGranted());
            if (marketingConsent && !current) {
                prefs.setMarketingConsentGranted(true);
                prefs.setMarketingConsentDate(now);
                log.info("User {} granted marketing consent", prefs.getUserId());
            } else if (!marketingConsent && current) {
                prefs.setMarketingConsentGranted(false);
                prefs.setMarketingConsentDate(null);
                prefs.setMarketingEnabled(false);
                log.info("User {} withdrew marketing consent; marketing disabled", prefs.getUserId());
            }
        }
    }

    static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value.trim(), QUIET_HOURS_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid time format: " + value + ". Expected HH:MM");
        }
    }

    private String validateTimezone(String timezone) {
        try {
            return ZoneId.of(timezone).getId();
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone);
        }
    }

    private void requireRange(int value, int min, int max, String message) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(message);
        }
    }
}
