package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChildResponse {

    private boolean success;
    private String message;
    private String error;
    private ChildView child;

    public static ChildResponse ok(ChildView child, String message) {
        return new ChildResponse(true, message, null, child);
    }

    public static ChildResponse failure(String error) {
        return new ChildResponse(false, null, error, null);
    }
}
