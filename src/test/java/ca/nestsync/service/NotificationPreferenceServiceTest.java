package ca.nestsync.service;

import ca.nestsync.dto.request.UpdateNotificationPreferencesInput;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationPreferences.DeviceToken;
import ca.nestsync.repository.NotificationPreferencesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationPreferenceService.
 *
 * @see ca.nestsync.service.NotificationPreferenceService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationPreferenceService Unit Tests")
class NotificationPreferenceServiceTest {

    @Mock
    private NotificationPreferencesRepository preferencesRepository;

    @InjectMocks
    private NotificationPreferenceService preferenceService;

    private UUID userId;
    private NotificationPreferences prefs;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        prefs = new NotificationPreferences(userId);
    }

    private void existingPreferences() {
        when(preferencesRepository.findByUserId(userId)).thenReturn(Optional.of(prefs));
    }

    private void saveReturnsArgument() {
        when(preferencesRepository.save(any(NotificationPreferences.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("First read creates preferences with defaults")
    void testGetOrCreateDefaults() {
        // Arrange
        when(preferencesRepository.findByUserId(userId)).thenReturn(Optional.empty());
        saveReturnsArgument();

        // Act
        NotificationPreferences created = preferenceService.getOrCreate(userId);

        // Assert
        assertEquals(userId, created.getUserId());
        assertTrue(created.getNotificationsEnabled());
        assertFalse(created.getNotificationConsentGranted());
        assertEquals(3, created.getStockAlertThreshold());
        assertEquals(LocalTime.of(22, 0), created.getQuietHoursStart());
        assertEquals("America/Toronto", created.getUserTimezone());
    }

    @Test
    @DisplayName("Partial update changes only the given fields")
    void testPartialUpdate() {
        // Arrange
        existingPreferences();
        saveReturnsArgument();
        UpdateNotificationPreferencesInput input = new UpdateNotificationPreferencesInput();
        input.setSmsNotifications(true);
        input.setQuietHoursStart("23:30");
        input.setStockAlertThreshold(7);
        input.setUserTimezone("America/Vancouver");

        // Act
        NotificationPreferences updated = preferenceService.update(userId, input);

        // Assert
        assertTrue(updated.getSmsNotifications());
        assertEquals(LocalTime.of(23, 30), updated.getQuietHoursStart());
        assertEquals(LocalTime.of(8, 0), updated.getQuietHoursEnd());
        assertEquals(7, updated.getStockAlertThreshold());
        assertEquals("America/Vancouver", updated.getUserTimezone());
        assertTrue(updated.getEmailNotifications());
    }

    @Test
    @DisplayName("Out-of-range values, bad times and unknown zones are rejected")
    void testUpdateValidation() {
        // Arrange
        existingPreferences();
        UpdateNotificationPreferencesInput threshold = new UpdateNotificationPreferencesInput();
        threshold.setStockAlertThreshold(31);
        UpdateNotificationPreferencesInput time = new UpdateNotificationPreferencesInput();
        time.setQuietHoursEnd("8am");
        UpdateNotificationPreferencesInput zone = new UpdateNotificationPreferencesInput();
        zone.setUserTimezone("Mars/Olympus");
        UpdateNotificationPreferencesInput limit = new UpdateNotificationPreferencesInput();
        limit.setDailyNotificationLimit(0);

        // Act & Assert
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> preferenceService.update(userId, threshold));
        assertEquals("Stock alert threshold must be between 1 and 30 days", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> preferenceService.update(userId, time));
        assertThrows(IllegalArgumentException.class, () -> preferenceService.update(userId, zone));
        assertThrows(IllegalArgumentException.class, () -> preferenceService.update(userId, limit));
        verify(preferencesRepository, never()).save(any());
    }

    @Test
    @DisplayName("Granting consent stamps the date; withdrawing disables notifications")
    void testConsentTransitions() {
        // Arrange
        existingPreferences();
        saveReturnsArgument();
        UpdateNotificationPreferencesInput grant = new UpdateNotificationPreferencesInput();
        grant.setNotificationConsentGranted(true);
        grant.setMarketingConsentGranted(true);
        grant.setMarketingEnabled(true);

        // Act
        preferenceService.update(userId, grant);

        // Assert
        assertTrue(prefs.getNotificationConsentGranted());
        assertNotNull(prefs.getNotificationConsentDate());
        assertTrue(prefs.getMarketingConsentGranted());
        assertNotNull(prefs.getMarketingConsentDate());

        // Act
        UpdateNotificationPreferencesInput withdraw = new UpdateNotificationPreferencesInput();
        withdraw.setNotificationConsentGranted(false);
        withdraw.setMarketingConsentGranted(false);
        preferenceService.update(userId, withdraw);

        // Assert
        assertFalse(prefs.getNotificationConsentGranted());
        assertNull(prefs.getNotificationConsentDate());
        assertFalse(prefs.getNotificationsEnabled());
        assertFalse(prefs.getMarketingConsentGranted());
        assertFalse(prefs.getMarketingEnabled());
    }

    @Test
    @DisplayName("Re-registering a token replaces it; only five tokens are kept")
    void testRegisterDeviceToken() {
        // Arrange
        existingPreferences();
        saveReturnsArgument();
        List<DeviceToken> tokens = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            tokens.add(new DeviceToken("token-000000" + i, "ios", "2024-01-0" + i + "T00:00"));
        }
        prefs.setDeviceTokens(tokens);

        // Act
        preferenceService.registerDeviceToken(userId, "token-0000003", "android");
        NotificationPreferences result = preferenceService.registerDeviceToken(userId, "token-0000009", "web");

        // Assert
        List<DeviceToken> kept = result.getDeviceTokens();
        assertEquals(5, kept.size());
        assertEquals("token-0000002", kept.get(0).getToken());
        assertEquals("token-0000003", kept.get(3).getToken());
        assertEquals("android", kept.get(3).getPlatform());
        assertEquals("token-0000009", kept.get(4).getToken());
    }

    @Test
    @DisplayName("Token registration validates platform and token length")
    void testRegisterDeviceTokenValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> preferenceService.registerDeviceToken(userId, "token-0000001", "blackberry"));
        assertThrows(IllegalArgumentException.class,
                () -> preferenceService.registerDeviceToken(userId, "short", "ios"));
        verifyNoInteractions(preferencesRepository);
    }

    @Test
    @DisplayName("Quiet hours wrap past midnight")
    void testQuietHours() {
        assertTrue(prefs.isInQuietHours(LocalTime.of(23, 15)));
        assertTrue(prefs.isInQuietHours(LocalTime.of(7, 59)));
        assertFalse(prefs.isInQuietHours(LocalTime.of(8, 0)));
        assertFalse(prefs.isInQuietHours(LocalTime.of(12, 0)));

        prefs.setQuietHoursStart(LocalTime.of(13, 0));
        prefs.setQuietHoursEnd(LocalTime.of(15, 0));
        assertTrue(prefs.isInQuietHours(LocalTime.of(14, 0)));
        assertFalse(prefs.isInQuietHours(LocalTime.of(23, 0)));
    }

    @Test
    @DisplayName("Equal quiet hours start and end form an empty window")
    void testQuietHoursEqualBounds() {
        prefs.setQuietHoursStart(LocalTime.of(22, 0));
        prefs.setQuietHoursEnd(LocalTime.of(22, 0));

        for (int hour = 0; hour < 24; hour++) {
            assertFalse(prefs.isInQuietHours(LocalTime.of(hour, 0)), "hour " + hour);
        }
    }

    @Test
    @DisplayName("An update leaving quiet hours with the same start and end is rejected")
    void testUpdateRejectsEqualQuietHours() {
        // Arrange
        existingPreferences();
        UpdateNotificationPreferencesInput input = new UpdateNotificationPreferencesInput();
        input.setQuietHoursEnd("22:00");

        // Act & Assert
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> preferenceService.update(userId, input));
        assertEquals("Quiet hours start and end must be different times", ex.getMessage());
        verify(preferencesRepository, never()).save(any());
    }
}
