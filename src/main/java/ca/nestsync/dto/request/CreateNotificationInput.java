package ca.nestsync.dto.request;

import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationInput {

    /**
     * Target user; when present it must be the caller.
     */
    private UUID userId;

    private UUID childId;

    @NotNull
    private NotificationType notificationType;

    @NotNull
    private NotificationPriority priority;

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    @NotBlank(message = "Message is required")
    private String message;

    /**
     * JSON object as a string.
     */
    private String dataPayload;

    private String scheduledFor;
}
