package ca.nestsync.dto.response;

import ca.nestsync.entity.UserProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {

    private boolean success;
    private String message;
    private String error;
    private UserProfile user;

    public static UserProfileResponse ok(UserProfile user, String message) {
        return new UserProfileResponse(true, message, null, user);
    }

    public static UserProfileResponse failure(String error) {
        return new UserProfileResponse(false, null, error, null);
    }
}
