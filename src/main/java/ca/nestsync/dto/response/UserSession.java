package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Supabase session handed back to the client after sign-in or refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSession {

    private String accessToken;
    private String refreshToken;
    private Integer expiresIn;
    private String tokenType;
}
