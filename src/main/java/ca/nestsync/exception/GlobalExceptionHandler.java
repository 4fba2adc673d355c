package ca.nestsync.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the REST endpoints (health, info, Stripe webhook).
 *
 * Errors are rendered as RFC 7807 problem details:
 * <pre>
 * {
 *   "type": "https://api.nestsync.ca/errors/invalid-webhook-signature",
 *   "title": "Invalid Webhook Signature",
 *   "status": 400,
 *   "detail": "Invalid webhook signature",
 *   "instance": "/webhooks/stripe",
 *   "timestamp": "2025-10-02T10:30:00"
 * }
 * </pre>
 *
 * GraphQL errors are resolved separately by {@link GraphQlExceptionResolver}.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.nestsync.ca/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleWebhookSignatureException(
            WebhookSignatureException ex,
            WebRequest request
    ) {
        log.warn("Webhook signature verification failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Webhook Signature",
                "Invalid webhook signature",
                request,
                "invalid-webhook-signature"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Anonymous callers get 401, authenticated callers without access get 403.
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorizedException(
            UnauthorizedException ex,
            WebRequest request
    ) {
        log.warn("Authorization failed: {}", ex.getMessage());

        HttpStatus status = ex.isAuthenticationMissing() ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN;
        ProblemDetail problemDetail = createProblemDetail(
                status,
                ex.isAuthenticationMissing() ? "Authentication Required" : "Access Denied",
                ex.getMessage(),
                request,
                ex.isAuthenticationMissing() ? "authentication-required" : "access-denied"
        );

        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.warn("Resource not found: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request,
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Payment processor failures. 502 because the upstream failed, not the request.
     */
    @ExceptionHandler(BillingException.class)
    public ResponseEntity<ProblemDetail> handleBillingException(
            BillingException ex,
            WebRequest request
    ) {
        log.error("Billing operation failed: operation={}, code={}, message={}",
                ex.getOperation(), ex.getErrorCode(), ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_GATEWAY,
                "Billing Failed",
                "The payment processor could not complete the request. Please try again later.",
                request,
                "billing-failed"
        );
        problemDetail.setProperty("errorCode", ex.getErrorCode());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problemDetail);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.put(error.getField(), error.getDefaultMessage()));

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request,
                "validation-failed"
        );
        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or missing.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ProblemDetail> handleIllegalStateException(
            IllegalStateException ex,
            WebRequest request
    ) {
        log.warn("Request conflicts with current state: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Conflict",
                ex.getMessage(),
                request,
                "conflict"
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    /**
     * Fallback for anything unhandled. The message is not exposed; the errorId
     * correlates the response with the logged stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));
        return problemDetail;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
