package ca.nestsync.dto.response;

import ca.nestsync.entity.Family;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyResponse {

    private boolean success;
    private String message;
    private String error;
    private Family family;

    public static FamilyResponse ok(Family family, String message) {
        return new FamilyResponse(true, message, null, family);
    }

    public static FamilyResponse failure(String error) {
        return new FamilyResponse(false, null, error, null);
    }
}
