package ca.nestsync.dto.response;

import ca.nestsync.entity.NotificationQueue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of queueing a notification; one queue entry per enabled channel.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationResponse {

    private boolean success;
    private String message;
    private String error;
    private List<NotificationQueue> notifications = List.of();

    public static CreateNotificationResponse ok(List<NotificationQueue> notifications, String message) {
        return new CreateNotificationResponse(true, message, null, notifications);
    }

    public static CreateNotificationResponse failure(String error) {
        return new CreateNotificationResponse(false, null, error, List.of());
    }
}
