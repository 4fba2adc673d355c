package ca.nestsync.dto.response;

import ca.nestsync.entity.UsageLog;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageLogResponse {

    private boolean success;
    private String message;
    private String error;
    private UsageLog usageLog;

    public static UsageLogResponse ok(UsageLog usageLog, String message) {
        return new UsageLogResponse(true, message, null, usageLog);
    }

    public static UsageLogResponse failure(String error) {
        return new UsageLogResponse(false, null, error, null);
    }
}
