package ca.nestsync.graphql;

import ca.nestsync.dto.request.CreateNotificationInput;
import ca.nestsync.dto.request.UpdateNotificationPreferencesInput;
import ca.nestsync.dto.response.CreateNotificationResponse;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.NotificationPreferencesResponse;
import ca.nestsync.entity.NotificationDeliveryLog;
import ca.nestsync.entity.NotificationPreferences;
import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.NotificationPreferenceService;
import ca.nestsync.service.NotificationService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.UUID;

@Controller
@RequiredArgsConstructor
public class NotificationGraphQlController {

    private final NotificationService notificationService;
    private final NotificationPreferenceService preferenceService;
    private final UserService userService;

    @QueryMapping
    public NotificationPreferences getNotificationPreferences() {
        return preferenceService.getOrCreate(userService.requireCurrentUser().getId());
    }

    @QueryMapping
    public List<NotificationDeliveryLog> getNotificationHistory(@Argument Integer limit, @Argument Integer offset) {
        return notificationService.getHistory(userService.requireCurrentUser(),
                limit != null ? limit : 50, offset != null ? offset : 0);
    }

    @QueryMapping
    public List<NotificationQueue> getPendingNotifications() {
        return notificationService.getPending(userService.requireCurrentUser());
    }

    @MutationMapping
    public NotificationPreferencesResponse updateNotificationPreferences(
            @Argument @Valid UpdateNotificationPreferencesInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> NotificationPreferencesResponse.ok(preferenceService.update(user.getId(), input),
                        "Notification preferences updated successfully"),
                NotificationPreferencesResponse::failure);
    }

    @MutationMapping
    public MutationResponse registerDeviceToken(@Argument String token, @Argument String platform) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            preferenceService.registerDeviceToken(user.getId(), token, platform);
            return MutationResponse.ok("Device token registered successfully");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public CreateNotificationResponse createNotification(@Argument @Valid CreateNotificationInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            List<NotificationQueue> queued = notificationService.createNotification(user, input);
            return CreateNotificationResponse.ok(queued,
                    "Notification queued for " + queued.size() + " channel(s)");
        }, CreateNotificationResponse::failure);
    }

    @MutationMapping
    public MutationResponse markNotificationRead(@Argument UUID notificationId, @Argument String action) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            notificationService.markNotificationRead(user, notificationId, action);
            return MutationResponse.ok("Notification marked as " + action);
        }, MutationResponse::failure);
    }

    @MutationMapping
    public MutationResponse testNotification() {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            notificationService.testNotification(user);
            return MutationResponse.ok("Test notification sent successfully");
        }, MutationResponse::failure);
    }
}
