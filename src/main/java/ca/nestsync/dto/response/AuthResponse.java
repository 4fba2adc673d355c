package ca.nestsync.dto.response;

import ca.nestsync.entity.UserProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of sign-up, sign-in and token refresh.
 *
 * {@code session} is null after sign-up until the email address is verified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private boolean success;
    private String message;
    private String error;
    private UserProfile user;
    private UserSession session;

    public static AuthResponse failure(String error) {
        return AuthResponse.builder().success(false).error(error).build();
    }
}
