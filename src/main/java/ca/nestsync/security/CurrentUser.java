package ca.nestsync.security;

import ca.nestsync.exception.UnauthorizedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;
import java.util.UUID;

/**
 * Static accessors for the authenticated Supabase identity of the current request.
 */
public final class CurrentUser {

    private CurrentUser() {
    }

    /**
     * @return the Supabase user id, if the request carries a valid token
     */
    public static Optional<UUID> supabaseUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || authentication instanceof AnonymousAuthenticationToken
                || !authentication.isAuthenticated()
                || !(authentication.getPrincipal() instanceof String)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString((String) authentication.getPrincipal()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /**
     * @return the Supabase user id
     * @throws UnauthorizedException if the request is anonymous
     */
    public static UUID requireSupabaseUserId() {
        return supabaseUserId().orElseThrow(UnauthorizedException::authenticationRequired);
    }

    /**
     * @return the email claim of the token, or null when anonymous
     */
    public static String email() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getDetails() instanceof String) {
            return (String) authentication.getDetails();
        }
        return null;
    }
}
