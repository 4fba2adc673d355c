package ca.nestsync.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Publishes queued notification ids to RabbitMQ for asynchronous delivery.
 *
 * Flow:
 * 1. NotificationService writes one notification_queue row per channel
 * 2. This producer publishes each row id to {@code notification.exchange}
 * 3. NotificationDeliveryConsumer delivers the entry and writes the delivery log
 *
 * Message Format:
 * - Payload: UUID (notification queue entry id)
 * - Exchange: notification.exchange (direct)
 * - Routing Key: notification.deliver
 *
 * @see ca.nestsync.config.RabbitMQConfig
 * @see NotificationDeliveryConsumer
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationDeliveryProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.notification:notification.exchange}")
    private String notificationExchange;

    @Value("${app.rabbitmq.routing-key.notification:notification.deliver}")
    private String deliveryRoutingKey;

    /**
     * Publish one queue entry for delivery.
     *
     * @param queueEntryId id of the notification_queue row
     * @throws IllegalArgumentException if queueEntryId is null
     */
    public void sendDeliveryTask(UUID queueEntryId) {
        if (queueEntryId == null) {
            log.error("Attempted to publish null notification queue id");
            throw new IllegalArgumentException("Notification queue id cannot be null");
        }

        log.debug("Publishing notification {} to exchange={}, routingKey={}",
                queueEntryId, notificationExchange, deliveryRoutingKey);

        try {
            rabbitTemplate.convertAndSend(notificationExchange, deliveryRoutingKey, queueEntryId);
            log.info("Notification queued for delivery: queueEntryId={}", queueEntryId);
        } catch (Exception e) {
            log.error("Failed to publish notification: queueEntryId={}, error={}",
                    queueEntryId, e.getMessage(), e);
            throw e;
        }
    }

    public String getExchange() {
        return notificationExchange;
    }

    public String getRoutingKey() {
        return deliveryRoutingKey;
    }
}
