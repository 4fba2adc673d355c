package ca.nestsync.exception;

import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions thrown by GraphQL resolvers to GraphQL errors.
 *
 * Each error carries an {@code errorCode} extension next to the standard
 * {@code classification}:
 * <ul>
 *   <li>{@link UnauthorizedException}: UNAUTHORIZED or FORBIDDEN</li>
 *   <li>{@link ResourceNotFoundException}: NOT_FOUND</li>
 *   <li>{@link IllegalArgumentException}, {@link ConstraintViolationException}: BAD_REQUEST</li>
 *   <li>{@link IllegalStateException}: BAD_REQUEST with code CONFLICT</li>
 *   <li>{@link BillingException}: INTERNAL_ERROR with the billing code</li>
 *   <li>anything else: INTERNAL_ERROR, message hidden</li>
 * </ul>
 */
@Component
@Slf4j
public class GraphQlExceptionResolver extends DataFetcherExceptionResolverAdapter {

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        if (ex instanceof UnauthorizedException) {
            UnauthorizedException unauthorized = (UnauthorizedException) ex;
            log.warn("GraphQL {} rejected: {}", env.getField().getName(), ex.getMessage());
            return build(env,
                    unauthorized.isAuthenticationMissing() ? ErrorType.UNAUTHORIZED : ErrorType.FORBIDDEN,
                    unauthorized.isAuthenticationMissing() ? "AUTHENTICATION_REQUIRED" : "ACCESS_DENIED",
                    ex.getMessage());
        }
        if (ex instanceof ResourceNotFoundException) {
            return build(env, ErrorType.NOT_FOUND, "NOT_FOUND", ex.getMessage());
        }
        if (ex instanceof ConstraintViolationException) {
            String message = violationMessages((ConstraintViolationException) ex);
            log.debug("GraphQL {} input rejected: {}", env.getField().getName(), message);
            return build(env, ErrorType.BAD_REQUEST, "VALIDATION_FAILED", message);
        }
        if (ex instanceof IllegalArgumentException) {
            log.debug("GraphQL {} validation failed: {}", env.getField().getName(), ex.getMessage());
            return build(env, ErrorType.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage());
        }
        if (ex instanceof IllegalStateException) {
            return build(env, ErrorType.BAD_REQUEST, "CONFLICT", ex.getMessage());
        }
        if (ex instanceof BillingException) {
            BillingException billing = (BillingException) ex;
            log.error("GraphQL {} billing failure: {}", env.getField().getName(), ex.getMessage(), ex);
            return build(env, ErrorType.INTERNAL_ERROR, billing.getErrorCode(),
                    "The payment processor could not complete the request. Please try again later.");
        }

        String errorId = String.format("ERR-%d", System.currentTimeMillis());
        log.error("Unexpected GraphQL error [{}] in {}: {}", errorId, env.getField().getName(), ex.getMessage(), ex);
        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .extensions(Map.of("errorCode", "INTERNAL_ERROR", "errorId", errorId))
                .build();
    }

    /**
     * Constraint messages without the property paths, sorted so the order is stable.
     */
    static String violationMessages(ConstraintViolationException ex) {
        if (ex.getConstraintViolations() == null || ex.getConstraintViolations().isEmpty()) {
            return ex.getMessage();
        }
        return ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining("; "));
    }

    private GraphQLError build(DataFetchingEnvironment env, ErrorType type, String code, String message) {
        return GraphqlErrorBuilder.newError(env)
                .errorType(type)
                .message(message)
                .extensions(Map.of("errorCode", code))
                .build();
    }
}
