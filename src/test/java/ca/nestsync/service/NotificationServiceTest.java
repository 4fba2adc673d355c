package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.CreateNotificationInput;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.NotificationDeliveryLog;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationChannel;
import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.messaging.NotificationDeliveryProducer;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.NotificationDeliveryLogRepository;
import ca.nestsync.repository.NotificationQueueRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;

import java.net.ConnectException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationService.
 *
 * Tests the core notification flows:
 * - Consent, priority and marketing gates
 * - One queue row per enabled channel and immediate publishing
 * - Daily limit, scheduling and low-stock alerts
 *
 * @see ca.nestsync.service.NotificationService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService Unit Tests")
class NotificationServiceTest {

    @Mock
    private NotificationQueueRepository queueRepository;

    @Mock
    private NotificationDeliveryLogRepository deliveryLogRepository;

    @Mock
    private NotificationPreferenceService preferenceService;

    @Mock
    private ChildRepository childRepository;

    @Mock
    private NotificationDeliveryProducer producer;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private AppSettings appSettings;

    @InjectMocks
    private NotificationService notificationService;

    private UserProfile user;
    private NotificationPreferences prefs;

    @BeforeEach
    void setUp() {
        user = new UserProfile();
        user.setId(UUID.randomUUID());

        prefs = new NotificationPreferences(user.getId());
        prefs.setNotificationConsentGranted(true);
    }

    private CreateNotificationInput input(NotificationType type, NotificationPriority priority) {
        CreateNotificationInput input = new CreateNotificationInput();
        input.setNotificationType(type);
        input.setPriority(priority);
        input.setTitle("Diaper check");
        input.setMessage("Time for a change");
        return input;
    }

    private void queueSavesWithIds() {
        when(queueRepository.save(any(NotificationQueue.class))).thenAnswer(invocation -> {
            NotificationQueue entry = invocation.getArgument(0);
            entry.setId(UUID.randomUUID());
            return entry;
        });
    }

    @Test
    @DisplayName("A notification is queued once per enabled channel and published immediately")
    void testCreateNotificationPerChannel() {
        // Arrange
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(
                eq(user.getId()), eq(NotificationChannel.IN_APP), any(LocalDateTime.class))).thenReturn(0L);
        queueSavesWithIds();
        CreateNotificationInput input = input(NotificationType.DIAPER_CHANGE_REMINDER, NotificationPriority.IMPORTANT);
        input.setDataPayload("{\"source\":\"manual\"}");

        // Act
        List<NotificationQueue> entries = notificationService.createNotification(user, input);

        // Assert
        assertEquals(List.of(NotificationChannel.PUSH, NotificationChannel.EMAIL, NotificationChannel.IN_APP),
                entries.stream().map(NotificationQueue::getChannel).toList());
        assertEquals("manual", entries.get(0).getDataPayload().get("source"));
        verify(producer, times(3)).sendDeliveryTask(any(UUID.class));
    }

    @Test
    @DisplayName("Without notification consent nothing is queued")
    void testCreateNotificationWithoutConsent() {
        // Arrange
        prefs.setNotificationConsentGranted(false);
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> notificationService
                .createNotification(user, input(NotificationType.HEALTH_TIP, NotificationPriority.IMPORTANT)));
        assertEquals("User has not consented to notifications", ex.getMessage());
        verifyNoInteractions(queueRepository, producer);
    }

    @Test
    @DisplayName("Priority and marketing gates refuse with a reason")
    void testRefusalReasons() {
        assertEquals("User has disabled optional notifications", NotificationService.refusalReason(
                prefs, NotificationType.HEALTH_TIP, NotificationPriority.OPTIONAL));
        assertEquals("User has not consented to marketing notifications", NotificationService.refusalReason(
                prefs, NotificationType.MARKETING, NotificationPriority.IMPORTANT));

        prefs.setMarketingConsentGranted(true);
        prefs.setMarketingEnabled(true);
        assertNull(NotificationService.refusalReason(prefs, NotificationType.MARKETING, NotificationPriority.IMPORTANT));
    }

    @Test
    @DisplayName("Users cannot queue notifications for someone else")
    void testCreateNotificationForOtherUser() {
        // Arrange
        CreateNotificationInput input = input(NotificationType.HEALTH_TIP, NotificationPriority.IMPORTANT);
        input.setUserId(UUID.randomUUID());

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> notificationService.createNotification(user, input));
        verifyNoInteractions(preferenceService);
    }

    @Test
    @DisplayName("A child that is not the caller's is reported missing")
    void testCreateNotificationForForeignChild() {
        // Arrange
        CreateNotificationInput input = input(NotificationType.STOCK_ALERT, NotificationPriority.IMPORTANT);
        input.setChildId(UUID.randomUUID());
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(childRepository.findByIdAndParentIdAndIsDeletedFalse(input.getChildId(), user.getId()))
                .thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> notificationService.createNotification(user, input));
    }

    @Test
    @DisplayName("Malformed payload JSON is rejected")
    void testCreateNotificationInvalidPayload() {
        // Arrange
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        CreateNotificationInput input = input(NotificationType.HEALTH_TIP, NotificationPriority.IMPORTANT);
        input.setDataPayload("{not json");

        // Act & Assert
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> notificationService.createNotification(user, input));
        assertEquals("Invalid JSON in data_payload", ex.getMessage());
    }

    @Test
    @DisplayName("The daily limit stops further notifications")
    void testDailyLimitReached() {
        // Arrange
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(
                eq(user.getId()), eq(NotificationChannel.IN_APP), any(LocalDateTime.class))).thenReturn(10L);

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> notificationService
                .createNotification(user, input(NotificationType.HEALTH_TIP, NotificationPriority.IMPORTANT)));
        assertEquals("Daily notification limit reached", ex.getMessage());
        verify(queueRepository, never()).save(any());
    }

    @Test
    @DisplayName("Future notifications are left for the scheduler")
    void testScheduledNotificationNotPublished() {
        // Arrange
        prefs.setEmailNotifications(false);
        prefs.setPushNotifications(false);
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(any(), any(), any())).thenReturn(0L);
        queueSavesWithIds();
        CreateNotificationInput input = input(NotificationType.DIAPER_CHANGE_REMINDER, NotificationPriority.IMPORTANT);
        input.setScheduledFor(LocalDateTime.now(ZoneOffset.UTC).plusHours(3) + "Z");

        // Act
        List<NotificationQueue> entries = notificationService.createNotification(user, input);

        // Assert
        assertEquals(1, entries.size());
        assertEquals(NotificationChannel.IN_APP, entries.get(0).getChannel());
        assertTrue(entries.get(0).getScheduledFor().isAfter(LocalDateTime.now(ZoneOffset.UTC)));
        verifyNoInteractions(producer);
    }

    @Test
    @DisplayName("A broker outage does not fail the request")
    void testPublishFailureIsLogged() {
        // Arrange
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(any(), any(), any())).thenReturn(0L);
        queueSavesWithIds();
        doThrow(new AmqpConnectException(new ConnectException("refused"))).when(producer).sendDeliveryTask(any());

        // Act
        List<NotificationQueue> entries = notificationService.createNotification(user,
                input(NotificationType.HEALTH_TIP, NotificationPriority.IMPORTANT));

        // Assert
        assertEquals(3, entries.size());
    }

    @Test
    @DisplayName("Low stock alerts fire when stock crosses the threshold and when it runs out")
    void testNotifyLowStock() {
        // Arrange
        Child child = new Child();
        child.setId(UUID.randomUUID());
        child.setParentId(user.getId());
        child.setName("Emma");
        when(preferenceService.getOrCreate(user.getId())).thenReturn(prefs);
        when(queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(any(), any(), any())).thenReturn(0L);
        queueSavesWithIds();

        // Act
        notificationService.notifyLowStock(child, 5, 4);
        notificationService.notifyLowStock(child, 4, 3);
        notificationService.notifyLowStock(child, 3, 2);
        notificationService.notifyLowStock(child, 2, 1);
        notificationService.notifyLowStock(child, 1, 0);

        // Assert
        ArgumentCaptor<NotificationQueue> entries = ArgumentCaptor.forClass(NotificationQueue.class);
        verify(queueRepository, times(6)).save(entries.capture());
        NotificationQueue first = entries.getAllValues().get(0);
        assertEquals(NotificationType.STOCK_ALERT, first.getNotificationType());
        assertEquals("Emma has 3 diapers left.", first.getMessage());
        assertEquals(child.getId(), first.getChildId());
        assertEquals("Emma is out of diapers.", entries.getAllValues().get(3).getMessage());
    }

    @Test
    @DisplayName("Stock that does not go down raises no alert")
    void testNotifyLowStockWithoutDrop() {
        // Arrange
        Child child = new Child();
        child.setId(UUID.randomUUID());
        child.setParentId(user.getId());

        // Act
        notificationService.notifyLowStock(child, 0, 0);
        notificationService.notifyLowStock(child, 2, 2);

        // Assert
        verifyNoInteractions(preferenceService, queueRepository);
    }

    @Test
    @DisplayName("Marking a notification accepts only known actions")
    void testMarkNotificationRead() {
        // Arrange
        NotificationDeliveryLog deliveryLog = new NotificationDeliveryLog();
        UUID logId = UUID.randomUUID();
        when(deliveryLogRepository.findByIdAndUserId(logId, user.getId())).thenReturn(Optional.of(deliveryLog));

        // Act
        notificationService.markNotificationRead(user, logId, "Opened");

        // Assert
        assertNotNull(deliveryLog.getOpenedAt());
        verify(deliveryLogRepository).save(deliveryLog);
        assertThrows(IllegalArgumentException.class,
                () -> notificationService.markNotificationRead(user, logId, "archived"));
    }

    @Test
    @DisplayName("Test notifications are refused outside development")
    void testTestNotificationOutsideDevelopment() {
        // Arrange
        when(appSettings.isDebug()).thenReturn(false);
        when(appSettings.isDevelopment()).thenReturn(false);

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> notificationService.testNotification(user));
        verifyNoInteractions(deliveryLogRepository);
    }
}
