package ca.nestsync.graphql;

import ca.nestsync.exception.BillingException;
import ca.nestsync.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a mutation or analytics query whose result type carries
 * {@code success}/{@code error} and turns expected failures into a failure payload.
 *
 * Validation, business-rule, not-found and billing failures become
 * {@code success=false} with the exception message. Authorization failures
 * and anything unexpected still propagate to
 * {@link ca.nestsync.exception.GraphQlExceptionResolver}.
 */
@Slf4j
final class MutationPayloads {

    private MutationPayloads() {
    }

    static <T> T guard(Supplier<T> action, Function<String, T> onFailure) {
        try {
            return action.get();
        } catch (IllegalArgumentException | IllegalStateException | ResourceNotFoundException e) {
            log.debug("Mutation rejected: {}", e.getMessage());
            return onFailure.apply(e.getMessage());
        } catch (BillingException e) {
            log.error("Billing operation '{}' failed: {}", e.getOperation(), e.getMessage(), e);
            return onFailure.apply(e.getMessage());
        }
    }
}
