package ca.nestsync.exception;

/**
 * Exception thrown when a call to the payment processor fails.
 *
 * Wraps {@link com.stripe.exception.StripeException} so callers outside the
 * Stripe gateway never depend on the SDK's checked exception types.
 *
 * @see ca.nestsync.service.StripeGateway
 */
public class BillingException extends RuntimeException {

    private final String operation;
    private final String errorCode;

    public BillingException(String operation, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.errorCode = errorCode;
    }

    public String getOperation() {
        return operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static BillingException stripeFailure(String operation, Throwable cause) {
        return new BillingException(
                operation,
                "STRIPE_ERROR",
                String.format("Payment processor call '%s' failed: %s", operation, cause.getMessage()),
                cause
        );
    }

    public static BillingException notConfigured() {
        return new BillingException(
                "configuration",
                "STRIPE_NOT_CONFIGURED",
                "Payment processing is not configured for this environment.",
                null
        );
    }

    /**
     * Failure carrying a message fit for the end user; the Stripe error stays in the cause.
     */
    public static BillingException failed(String operation, String userMessage, Throwable cause) {
        return new BillingException(operation, "STRIPE_ERROR", userMessage, cause);
    }
}
