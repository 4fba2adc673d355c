package ca.nestsync.graphql;

import ca.nestsync.exception.BillingException;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.exception.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MutationPayloads Unit Tests")
class MutationPayloadsTest {

    @Test
    @DisplayName("A successful action returns its own result")
    void testSuccess() {
        assertEquals("ok", MutationPayloads.guard(() -> "ok", error -> "failed: " + error));
    }

    @Test
    @DisplayName("Expected failures become failure payloads carrying the message")
    void testExpectedFailures() {
        assertEquals("failed: Family name is required", MutationPayloads.guard(() -> {
            throw new IllegalArgumentException("Family name is required");
        }, error -> "failed: " + error));
        assertEquals("failed: Email mismatch", MutationPayloads.guard(() -> {
            throw new IllegalStateException("Email mismatch");
        }, error -> "failed: " + error));
        assertEquals("failed: Family not found", MutationPayloads.guard(() -> {
            throw new ResourceNotFoundException("Family not found");
        }, error -> "failed: " + error));
        assertEquals("failed: Card declined", MutationPayloads.guard(() -> {
            throw new BillingException("subscribe", "card_declined", "Card declined", null);
        }, error -> "failed: " + error));
    }

    @Test
    @DisplayName("Authorization failures still propagate")
    void testUnauthorizedPropagates() {
        assertThrows(UnauthorizedException.class, () -> MutationPayloads.guard(() -> {
            throw new UnauthorizedException("Authentication required");
        }, error -> "failed: " + error));
    }
}
