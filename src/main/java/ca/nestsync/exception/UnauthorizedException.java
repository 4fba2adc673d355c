package ca.nestsync.exception;

/**
 * Exception thrown when a caller is anonymous or lacks access to a resource.
 *
 * Covers the per-user and per-family isolation rules: a parent may only touch
 * their own children, and a caregiver only what their family role allows.
 *
 * GlobalExceptionHandler maps this to HTTP 401/403; the GraphQL resolver maps
 * it to UNAUTHORIZED/FORBIDDEN.
 */
public class UnauthorizedException extends RuntimeException {

    private final boolean authenticationMissing;

    public UnauthorizedException(String message) {
        this(message, false);
    }

    private UnauthorizedException(String message, boolean authenticationMissing) {
        super(message);
        this.authenticationMissing = authenticationMissing;
    }

    /**
     * @return true when no user is authenticated, as opposed to a user lacking access
     */
    public boolean isAuthenticationMissing() {
        return authenticationMissing;
    }

    public static UnauthorizedException authenticationRequired() {
        return new UnauthorizedException("Authentication required", true);
    }

    public static UnauthorizedException accessDenied(String resourceType, String resourceId) {
        return new UnauthorizedException(
                String.format("Access denied to %s '%s'.", resourceType, resourceId));
    }

    public static UnauthorizedException missingPermission(String permission) {
        return new UnauthorizedException(
                String.format("Insufficient permissions: '%s' is required.", permission));
    }

    public static UnauthorizedException crossUserAccess() {
        return new UnauthorizedException("You can only perform this action for your own account.");
    }
}
