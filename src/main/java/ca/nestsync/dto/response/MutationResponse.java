package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Generic mutation result.
 *
 * Business-rule failures are reported with {@code success=false} and a
 * user-facing {@code error}; authentication failures are GraphQL errors instead.
 *
 * Example:
 * <pre>
 * { "success": false, "message": null, "error": "Child not found" }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutationResponse {

    private boolean success;
    private String message;
    private String error;

    public static MutationResponse ok(String message) {
        return new MutationResponse(true, message, null);
    }

    public static MutationResponse failure(String error) {
        return new MutationResponse(false, null, error);
    }
}
