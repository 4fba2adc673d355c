package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionResponse {

    private boolean success;
    private String message;
    private String error;
    private SubscriptionView subscription;

    public static SubscriptionResponse ok(SubscriptionView subscription, String message) {
        return new SubscriptionResponse(true, message, null, subscription);
    }

    public static SubscriptionResponse failure(String error) {
        return new SubscriptionResponse(false, null, error, null);
    }
}
