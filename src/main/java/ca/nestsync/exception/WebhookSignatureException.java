package ca.nestsync.exception;

/**
 * Exception thrown when a webhook payload fails signature verification.
 * Mapped to HTTP 400 with the detail "Invalid webhook signature".
 */
public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
