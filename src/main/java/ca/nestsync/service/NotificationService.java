package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.CreateNotificationInput;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.NotificationDeliveryLog;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationChannel;
import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationStatus;
import ca.nestsync.entity.NotificationQueue.NotificationType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.messaging.NotificationDeliveryProducer;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.NotificationDeliveryLogRepository;
import ca.nestsync.repository.NotificationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Queues notifications and serves the notification inbox.
 *
 * A notification becomes one notification_queue row per enabled channel.
 * Rows due now are published to RabbitMQ once the transaction commits; later
 * ones are picked up by the scheduler.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private static final List<NotificationChannel> CHANNEL_ORDER = List.of(
            NotificationChannel.PUSH, NotificationChannel.EMAIL, NotificationChannel.SMS, NotificationChannel.IN_APP);
    private static final int MAX_PAGE_SIZE = 100;

    private final NotificationQueueRepository queueRepository;
    private final NotificationDeliveryLogRepository deliveryLogRepository;
    private final NotificationPreferenceService preferenceService;
    private final ChildRepository childRepository;
    private final NotificationDeliveryProducer producer;
    private final ObjectMapper objectMapper;
    private final AppSettings appSettings;

    /**
     * Queue a notification requested by the user for themselves.
     *
     * @return one queue entry per enabled channel
     * @throws IllegalStateException when preferences or consent forbid it
     * @throws IllegalArgumentException on an invalid payload or schedule
     */
    @Transactional
    public List<NotificationQueue> createNotification(UserProfile user, CreateNotificationInput input) {
        if (input.getUserId() != null && !input.getUserId().equals(user.getId())) {
            throw new IllegalStateException("You can only create notifications for yourself");
        }

        NotificationPreferences prefs = preferenceService.getOrCreate(user.getId());
        String refusal = refusalReason(prefs, input.getNotificationType(), input.getPriority());
        if (refusal != null) {
            throw new IllegalStateException(refusal);
        }

        if (input.getChildId() != null
                && childRepository.findByIdAndParentIdAndIsDeletedFalse(input.getChildId(), user.getId()).isEmpty()) {
            throw new ResourceNotFoundException("Child not found or not owned by user");
        }

        Map<String, Object> payload = parsePayload(input.getDataPayload());
        LocalDateTime now = now();
        LocalDateTime scheduledFor = input.getScheduledFor() != null ? parseSchedule(input.getScheduledFor()) : now;

        if (dailyLimitReached(prefs, now)) {
            throw new IllegalStateException("Daily notification limit reached");
        }

        List<NotificationQueue> entries = enqueue(prefs, input.getNotificationType(), input.getPriority(),
                input.getChildId(), input.getTitle(), input.getMessage(), payload, scheduledFor);
        log.info("Created {} notification for user {} on {} channel(s)",
                input.getNotificationType(), user.getId(), entries.size());
        return entries;
    }

    /**
     * Alert the child's parent when diaper stock drops to their threshold, and
     * again when it runs out. Stock that was already at or below the threshold
     * before the change raises nothing. Does nothing when stock alerts are off
     * or the user cannot receive them.
     *
     * @param diapersBefore stock before the change
     * @param diapersLeft stock after the change
     */
    @Transactional
    public void notifyLowStock(Child child, long diapersBefore, long diapersLeft) {
        if (diapersLeft >= diapersBefore) {
            return;
        }
        NotificationPreferences prefs = preferenceService.getOrCreate(child.getParentId());
        int threshold = prefs.getStockAlertThreshold();
        boolean crossedThreshold = diapersBefore > threshold && diapersLeft <= threshold;
        boolean ranOut = diapersLeft == 0;
        if (!Boolean.TRUE.equals(prefs.getStockAlertEnabled()) || !(crossedThreshold || ranOut)) {
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("childId", child.getId().toString());
        payload.put("diapersLeft", diapersLeft);
        String message = diapersLeft == 0
                ? child.getName() + " is out of diapers."
                : child.getName() + " has " + diapersLeft + (diapersLeft == 1 ? " diaper" : " diapers") + " left.";

        notifySystem(child.getParentId(), NotificationType.STOCK_ALERT, NotificationPriority.IMPORTANT,
                child.getId(), "Running low on diapers", message, payload);
    }

    /**
     * Queue a server-originated notification. Preferences, consent and the
     * daily limit are honoured; a refused notification is logged and dropped.
     */
    @Transactional
    public List<NotificationQueue> notifySystem(UUID userId, NotificationType type, NotificationPriority priority,
                                                UUID childId, String title, String message,
                                                Map<String, Object> payload) {
        NotificationPreferences prefs = preferenceService.getOrCreate(userId);
        String refusal = refusalReason(prefs, type, priority);
        LocalDateTime now = now();
        if (refusal == null && dailyLimitReached(prefs, now)) {
            refusal = "daily limit reached";
        }
        if (refusal != null) {
            log.debug("{} notification for user {} not queued: {}", type, userId, refusal);
            return List.of();
        }
        return enqueue(prefs, type, priority, childId, title, message, payload, now);
    }

    /**
     * Stamp opened, clicked or dismissed on a delivered notification.
     */
    @Transactional
    public void markNotificationRead(UserProfile user, UUID deliveryLogId, String action) {
        NotificationDeliveryLog deliveryLog = deliveryLogRepository.findByIdAndUserId(deliveryLogId, user.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Notification not found"));

        String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        LocalDateTime now = now();
        if ("opened".equals(normalized)) {
            deliveryLog.setOpenedAt(now);
        } else if ("clicked".equals(normalized)) {
            deliveryLog.setClickedAt(now);
        } else if ("dismissed".equals(normalized)) {
            deliveryLog.setDismissedAt(now);
        } else {
            throw new IllegalArgumentException("Action must be 'opened', 'clicked', or 'dismissed'");
        }
        deliveryLogRepository.save(deliveryLog);
        log.info("Notification {} marked as {} by user {}", deliveryLogId, normalized, user.getId());
    }

    @Transactional(readOnly = true)
    public List<NotificationDeliveryLog> getHistory(UserProfile user, int limit, int offset) {
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return deliveryLogRepository.findByUserIdOrderByCreatedAtDesc(user.getId(),
                new OffsetPageRequest(Math.max(0, offset), size));
    }

    @Transactional(readOnly = true)
    public List<NotificationQueue> getPending(UserProfile user) {
        return queueRepository.findByUserIdAndStatusInOrderByScheduledForAsc(user.getId(),
                List.of(NotificationStatus.PENDING));
    }

    /**
     * Write a test entry straight to the delivery log. Only available with
     * debug on or in the development environment.
     */
    @Transactional
    public NotificationDeliveryLog testNotification(UserProfile user) {
        if (!appSettings.isDebug() && !appSettings.isDevelopment()) {
            throw new IllegalStateException("Test notifications only available in development mode");
        }

        LocalDateTime now = now();
        NotificationDeliveryLog deliveryLog = new NotificationDeliveryLog();
        deliveryLog.setUserId(user.getId());
        deliveryLog.setNotificationType(NotificationType.SYSTEM_UPDATE);
        deliveryLog.setChannel(NotificationChannel.PUSH);
        deliveryLog.setTitle("Test Notification");
        deliveryLog.setMessage("This is a test notification from NestSync");
        deliveryLog.setStatus(NotificationStatus.SENT);
        deliveryLog.setExternalId("test-notification-dev");
        deliveryLog.setDeliveredAt(now);

        log.info("Sent test notification to user {}", user.getId());
        return deliveryLogRepository.save(deliveryLog);
    }

    /**
     * Why a notification of this type and priority may not be sent, or null.
     */
    static String refusalReason(NotificationPreferences prefs, NotificationType type, NotificationPriority priority) {
        if (!Boolean.TRUE.equals(prefs.getNotificationsEnabled())
                || !Boolean.TRUE.equals(prefs.getNotificationConsentGranted())) {
            return "User has not consented to notifications";
        }
        if (!prefs.isPriorityEnabled(priority)) {
            return "User has disabled " + priority.name().toLowerCase(Locale.ROOT) + " notifications";
        }
        if (type == NotificationType.MARKETING
                && (!Boolean.TRUE.equals(prefs.getMarketingConsentGranted())
                || !Boolean.TRUE.equals(prefs.getMarketingEnabled()))) {
            return "User has not consented to marketing notifications";
        }
        return null;
    }

    private boolean dailyLimitReached(NotificationPreferences prefs, LocalDateTime now) {
        long sentToday = queueRepository.countByUserIdAndChannelAndCreatedAtGreaterThanEqual(
                prefs.getUserId(), NotificationChannel.IN_APP, now.toLocalDate().atStartOfDay());
        return sentToday >= prefs.getDailyNotificationLimit();
    }

    private List<NotificationQueue> enqueue(NotificationPreferences prefs, NotificationType type,
                                            NotificationPriority priority, UUID childId, String title,
                                            String message, Map<String, Object> payload,
                                            LocalDateTime scheduledFor) {
        List<NotificationQueue> entries = new ArrayList<>();
        for (NotificationChannel channel : CHANNEL_ORDER) {
            if (!prefs.isChannelEnabled(channel)) {
                continue;
            }
            NotificationQueue entry = new NotificationQueue();
            entry.setUserId(prefs.getUserId());
            entry.setChildId(childId);
            entry.setNotificationType(type);
            entry.setPriority(priority);
            entry.setChannel(channel);
            entry.setTitle(title);
            entry.setMessage(message);
            entry.setDataPayload(payload != null ? payload : new HashMap<>());
            entry.setScheduledFor(scheduledFor);
            entries.add(queueRepository.save(entry));
        }

        if (!scheduledFor.isAfter(now())) {
            List<UUID> ids = entries.stream().map(NotificationQueue::getId).toList();
            afterCommit(() -> publish(ids));
        }
        return entries;
    }

    private void publish(List<UUID> ids) {
        try {
            ids.forEach(producer::sendDeliveryTask);
        } catch (AmqpException e) {
            log.error("Could not publish {} notification(s); the scheduler will retry", ids.size(), e);
        }
    }

    private void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    private Map<String, Object> parsePayload(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in data_payload");
        }
    }

    private LocalDateTime parseSchedule(String value) {
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("scheduledFor must be an ISO-8601 date-time");
            }
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
