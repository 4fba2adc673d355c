package ca.nestsync.dto.response;

import ca.nestsync.entity.CaregiverPresence;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresenceResponse {

    private boolean success;
    private String message;
    private String error;
    private CaregiverPresence presence;

    public static PresenceResponse ok(CaregiverPresence presence, String message) {
        return new PresenceResponse(true, message, null, presence);
    }

    public static PresenceResponse failure(String error) {
        return new PresenceResponse(false, null, error, null);
    }
}
