package ca.nestsync.dto.response;

import ca.nestsync.entity.NotificationPreferences;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferencesResponse {

    private boolean success;
    private String message;
    private String error;
    private NotificationPreferences preferences;

    public static NotificationPreferencesResponse ok(NotificationPreferences preferences, String message) {
        return new NotificationPreferencesResponse(true, message, null, preferences);
    }

    public static NotificationPreferencesResponse failure(String error) {
        return new NotificationPreferencesResponse(false, null, error, null);
    }
}
