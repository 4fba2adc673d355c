package ca.nestsync.dto.response;

import ca.nestsync.entity.ConsentRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsentResponse {

    private boolean success;
    private String message;
    private String error;
    private ConsentRecord consent;

    public static ConsentResponse ok(ConsentRecord consent, String message) {
        return new ConsentResponse(true, message, null, consent);
    }

    public static ConsentResponse failure(String error) {
        return new ConsentResponse(false, null, error, null);
    }
}
