package ca.nestsync.controller;

import ca.nestsync.exception.WebhookSignatureException;
import ca.nestsync.service.StripeWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives Stripe webhook deliveries.
 *
 * Endpoint: POST /webhooks/stripe
 * Authentication: none; every request must carry a valid {@code Stripe-Signature}.
 *
 * Example response:
 * <pre>
 * {
 *   "status": "processed",
 *   "subscription_id": "3f1c2a9e-7d51-4d8e-9c0a-5a3e1b2c4d6f"
 * }
 * </pre>
 *
 * An invalid signature answers 400 with the problem detail
 * "Invalid webhook signature" (see GlobalExceptionHandler).
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class StripeWebhookController {

    private final StripeWebhookService webhookService;

    /**
     * The body is taken as a raw string; re-serialising it would break the signature.
     */
    @PostMapping(value = "/stripe", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> handleStripeWebhook(
            @RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature
    ) {
        try {
            Map<String, Object> result = webhookService.handleWebhook(payload, signature);
            log.debug("Stripe webhook handled: {}", result);
            return ResponseEntity.ok(result);

        } catch (WebhookSignatureException e) {
            log.warn("Rejected Stripe webhook: {}", e.getMessage());
            throw e;  // GlobalExceptionHandler answers 400
        }
    }
}
