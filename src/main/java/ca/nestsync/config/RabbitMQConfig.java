package ca.nestsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ topology for asynchronous notification delivery.
 *
 * Architecture:
 * - Exchange: {@code notification.exchange} (direct)
 * - Queue: {@code notification.delivery.queue}, carries notification queue entry ids
 * - DLQ: {@code notification.delivery.dlq}, receives messages rejected by the consumer
 *
 * Messages are JSON encoded with Jackson.
 *
 * @see ca.nestsync.messaging.NotificationDeliveryProducer
 * @see ca.nestsync.messaging.NotificationDeliveryConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.notification:notification.exchange}")
    private String notificationExchange;

    @Value("${app.rabbitmq.queue.notification.delivery:notification.delivery.queue}")
    private String deliveryQueue;

    @Value("${app.rabbitmq.queue.notification.dlq:notification.delivery.dlq}")
    private String deliveryDLQ;

    @Value("${app.rabbitmq.routing-key.notification:notification.deliver}")
    private String deliveryRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:notification.deliver.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:86400000}")
    private long queueTTL;

    @Value("${app.rabbitmq.queue.max-length:10000}")
    private int queueMaxLength;

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * RabbitTemplate with JSON conversion and publish logging.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @return configured RabbitTemplate
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter());

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("Failed to publish notification message: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned ->
                log.error("Notification message returned - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyText()));

        return rabbitTemplate;
    }

    @Bean
    public Queue notificationDeliveryDLQ() {
        log.info("Configuring DLQ: {}", deliveryDLQ);
        return QueueBuilder.durable(deliveryDLQ).build();
    }

    /**
     * Main delivery queue. Expired or rejected messages go to the DLQ.
     *
     * @return notification delivery queue
     */
    @Bean
    public Queue notificationDeliveryQueue() {
        log.info("Configuring queue: {} (ttl={}, maxLength={})", deliveryQueue, queueTTL, queueMaxLength);

        return QueueBuilder.durable(deliveryQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-max-length", queueMaxLength)
                .withArgument("x-dead-letter-exchange", notificationExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange notificationExchange() {
        return new DirectExchange(notificationExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        return BindingBuilder
                .bind(notificationDeliveryDLQ())
                .to(notificationExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding notificationDeliveryBinding() {
        return BindingBuilder
                .bind(notificationDeliveryQueue())
                .to(notificationExchange())
                .with(deliveryRoutingKey);
    }

    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }
}
