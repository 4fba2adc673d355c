package ca.nestsync.messaging;

import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Default dispatcher. IN_APP entries are delivered by the delivery log itself;
 * push, email and SMS are written to the log until a provider is configured.
 * Push still requires at least one registered device token.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public String dispatch(NotificationQueue entry, NotificationPreferences preferences) {
        switch (entry.getChannel()) {
            case PUSH:
                if (preferences.getDeviceTokens() == null || preferences.getDeviceTokens().isEmpty()) {
                    throw new IllegalStateException("No registered device tokens");
                }
                log.info("Push notification {} to {} device(s) of user {}: {}", entry.getId(),
                        preferences.getDeviceTokens().size(), entry.getUserId(), entry.getTitle());
                break;
            case EMAIL:
            case SMS:
                log.info("{} notification {} for user {}: {}", entry.getChannel(),
                        entry.getId(), entry.getUserId(), entry.getTitle());
                break;
            default:
                log.debug("In-app notification {} stored for user {}", entry.getId(), entry.getUserId());
        }
        return entry.getChannel().name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
    }
}
