package ca.nestsync.messaging;

import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoggingNotificationDispatcher Unit Tests")
class LoggingNotificationDispatcherTest {

    private final LoggingNotificationDispatcher dispatcher = new LoggingNotificationDispatcher();

    private NotificationQueue entry;
    private NotificationPreferences prefs;

    @BeforeEach
    void setUp() {
        entry = new NotificationQueue();
        entry.setId(UUID.randomUUID());
        entry.setUserId(UUID.randomUUID());
        entry.setTitle("Running low on diapers");
        prefs = new NotificationPreferences(entry.getUserId());
    }

    @Test
    @DisplayName("Push without a registered device fails the attempt")
    void testPushWithoutDevice() {
        // Arrange
        entry.setChannel(NotificationChannel.PUSH);

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(entry, prefs));
        assertEquals("No registered device tokens", ex.getMessage());
    }

    @Test
    @DisplayName("Delivered notifications get a channel-prefixed external id")
    void testExternalIds() {
        // Arrange
        prefs.getDeviceTokens().add(new NotificationPreferences.DeviceToken("ExponentPushToken[abc123]", "ios", "2024-05-10T12:00:00Z"));

        // Act
        entry.setChannel(NotificationChannel.PUSH);
        String push = dispatcher.dispatch(entry, prefs);
        entry.setChannel(NotificationChannel.EMAIL);
        String email = dispatcher.dispatch(entry, prefs);

        // Assert
        assertTrue(push.startsWith("push-"));
        assertTrue(email.startsWith("email-"));
        assertNotEquals(push.substring(5), email.substring(6));
    }
}
