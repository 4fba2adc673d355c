package ca.nestsync.messaging;

import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;

/**
 * Hands one queued notification to its channel.
 */
public interface NotificationDispatcher {

    /**
     * Deliver the entry.
     *
     * @param entry queued notification
     * @param preferences the recipient's preferences (device tokens, channels)
     * @return provider reference for the delivery, stored on the delivery log
     * @throws IllegalStateException when the channel cannot reach the user
     */
    String dispatch(NotificationQueue entry, NotificationPreferences preferences);
}
