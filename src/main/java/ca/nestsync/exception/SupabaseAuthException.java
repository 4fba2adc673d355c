package ca.nestsync.exception;

/**
 * Exception thrown when Supabase Auth rejects a request or cannot be reached.
 *
 * {@code statusCode} is the HTTP status returned by Supabase, or 0 when the
 * call never got a response.
 */
public class SupabaseAuthException extends RuntimeException {

    private final int statusCode;

    public SupabaseAuthException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return true for 4xx answers, i.e. the caller's input was rejected
     */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public static SupabaseAuthException unreachable(String operation, Throwable cause) {
        return new SupabaseAuthException(0,
                String.format("Authentication service unavailable during %s", operation), cause);
    }
}
