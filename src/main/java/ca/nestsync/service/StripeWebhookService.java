package ca.nestsync.service;

import ca.nestsync.entity.BillingRecord;
import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationType;
import ca.nestsync.entity.Subscription;
import ca.nestsync.entity.Subscription.SubscriptionStatus;
import ca.nestsync.exception.BillingException;
import ca.nestsync.exception.WebhookSignatureException;
import ca.nestsync.repository.BillingRecordRepository;
import ca.nestsync.repository.SubscriptionRepository;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Invoice;
import com.stripe.model.InvoiceLineItem;
import com.stripe.model.StripeObject;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies Stripe webhook events to local subscriptions and billing history.
 *
 * Every event is verified against the endpoint secret and recorded in Redis
 * under {@code stripe:event:{id}} for 24 hours; a redelivered event answers
 * {@code duplicate} without touching the database. If processing fails, or the
 * surrounding transaction does not commit, the marker is removed so Stripe's
 * retry is handled normally.
 *
 * Result statuses: processed, not_found, ignored, duplicate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StripeWebhookService {

    static final String STATUS_PROCESSED = "processed";
    static final String STATUS_NOT_FOUND = "not_found";
    static final String STATUS_IGNORED = "ignored";
    static final String STATUS_DUPLICATE = "duplicate";

    private static final String EVENT_KEY_PREFIX = "stripe:event:";
    private static final Duration EVENT_TTL = Duration.ofHours(24);

    private final SubscriptionRepository subscriptionRepository;
    private final BillingRecordRepository billingRecordRepository;
    private final NotificationService notificationService;
    private final RedisTemplate<String, String> redisStringTemplate;

    @Value("${app.stripe.webhook-secret:}")
    private String webhookSecret;

    /**
     * Verify and apply one webhook delivery.
     *
     * @param payload raw request body, exactly as received
     * @param signature value of the {@code Stripe-Signature} header
     * @return result map with at least a {@code status} entry
     * @throws WebhookSignatureException if the signature does not verify
     */
    @Transactional
    public Map<String, Object> handleWebhook(String payload, String signature) {
        Event event = verify(payload, signature);
        log.info("Received Stripe webhook event: {} ({})", event.getType(), event.getId());

        if (!markReceived(event.getId())) {
            log.info("Duplicate Stripe event {} skipped", event.getId());
            return result(STATUS_DUPLICATE, "event_id", event.getId());
        }

        boolean clearedOnRollback = forgetUnlessCommitted(event.getId());
        try {
            return route(event);
        } catch (RuntimeException e) {
            if (!clearedOnRollback) {
                forget(event.getId());
            }
            log.error("Error processing Stripe event {} ({}): {}", event.getId(), event.getType(), e.getMessage(), e);
            throw e;
        }
    }

    Event verify(String payload, String signature) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            throw BillingException.notConfigured();
        }
        if (signature == null || signature.isBlank()) {
            throw new WebhookSignatureException("Missing Stripe-Signature header", null);
        }
        try {
            return Webhook.constructEvent(payload, signature, webhookSecret);
        } catch (SignatureVerificationException e) {
            throw new WebhookSignatureException("Invalid webhook signature", e);
        }
    }

    Map<String, Object> route(Event event) {
        String type = event.getType();
        if (type.startsWith("customer.subscription.")) {
            return dataObject(event, com.stripe.model.Subscription.class)
                    .map(stripeSubscription -> handleSubscriptionEvent(type, stripeSubscription))
                    .orElseGet(() -> result(STATUS_IGNORED, "event_type", type));
        }
        if (type.startsWith("invoice.")) {
            return dataObject(event, Invoice.class)
                    .map(invoice -> handleInvoiceEvent(type, invoice))
                    .orElseGet(() -> result(STATUS_IGNORED, "event_type", type));
        }
        log.info("Unhandled webhook event type: {}", type);
        return result(STATUS_IGNORED, "event_type", type);
    }

    Map<String, Object> handleSubscriptionEvent(String type, com.stripe.model.Subscription stripeSubscription) {
        Optional<Subscription> found = subscriptionRepository.findByStripeSubscriptionId(stripeSubscription.getId());
        if (found.isEmpty()) {
            log.warn("Subscription not found for Stripe ID: {}", stripeSubscription.getId());
            return result(STATUS_NOT_FOUND, "stripe_subscription_id", stripeSubscription.getId());
        }
        Subscription subscription = found.get();
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);

        switch (type) {
            case "customer.subscription.created":
                subscription.setStatus(SubscriptionStatus.ACTIVE);
                log.info("Subscription {} confirmed active", subscription.getId());
                break;
            case "customer.subscription.updated":
                applyUpdate(subscription, stripeSubscription);
                break;
            case "customer.subscription.deleted":
                subscription.setStatus(SubscriptionStatus.CANCELED);
                subscription.setCanceledAt(now);
                log.info("Cancelled subscription {}", subscription.getId());
                break;
            case "customer.subscription.trial_will_end":
                log.info("Trial ending for subscription {}", subscription.getId());
                notifyTrialEnding(subscription, stripeSubscription);
                return result(STATUS_PROCESSED, "subscription_id", subscription.getId().toString());
            default:
                log.info("Unhandled subscription event type: {}", type);
                return result(STATUS_IGNORED, "event_type", type);
        }

        subscriptionRepository.save(subscription);
        return result(STATUS_PROCESSED, "subscription_id", subscription.getId().toString());
    }

    private void applyUpdate(Subscription subscription, com.stripe.model.Subscription stripeSubscription) {
        SubscriptionStatus status = mapStatus(stripeSubscription.getStatus());
        if (status != null) {
            subscription.setStatus(status);
        }
        LocalDateTime start = StripeGateway.toDateTime(stripeSubscription.getCurrentPeriodStart());
        LocalDateTime end = StripeGateway.toDateTime(stripeSubscription.getCurrentPeriodEnd());
        if (start != null && end != null) {
            subscription.setCurrentPeriodStart(start);
            subscription.setCurrentPeriodEnd(end);
        }
        subscription.setCancelAtPeriodEnd(Boolean.TRUE.equals(stripeSubscription.getCancelAtPeriodEnd()));
        if (stripeSubscription.getCanceledAt() != null) {
            subscription.setCanceledAt(StripeGateway.toDateTime(stripeSubscription.getCanceledAt()));
        }
        log.info("Updated subscription {} from Stripe (status {})", subscription.getId(), subscription.getStatus());
    }

    Map<String, Object> handleInvoiceEvent(String type, Invoice invoice) {
        String stripeSubscriptionId = invoice.getSubscription();
        if (stripeSubscriptionId == null) {
            return result(STATUS_IGNORED, "reason", "no_subscription");
        }
        Optional<Subscription> found = subscriptionRepository.findByStripeSubscriptionId(stripeSubscriptionId);
        if (found.isEmpty()) {
            log.warn("Subscription not found for invoice: {}", stripeSubscriptionId);
            return result(STATUS_NOT_FOUND, "subscription_id", stripeSubscriptionId);
        }
        Subscription subscription = found.get();

        switch (type) {
            case "invoice.payment_succeeded":
                recordPayment(subscription, invoice);
                break;
            case "invoice.payment_failed":
                subscription.setStatus(SubscriptionStatus.PAST_DUE);
                subscriptionRepository.save(subscription);
                log.error("Payment failed for subscription {} (invoice {})", subscription.getId(), invoice.getId());
                break;
            case "invoice.upcoming":
                log.info("Upcoming invoice for subscription {}: ${} CAD",
                        subscription.getId(), fromCents(invoice.getAmountDue()));
                break;
            default:
                log.info("Unhandled invoice event type: {}", type);
                return result(STATUS_IGNORED, "event_type", type);
        }
        return result(STATUS_PROCESSED, "subscription_id", subscription.getId().toString());
    }

    private void recordPayment(Subscription subscription, Invoice invoice) {
        BigDecimal amountPaid = fromCents(invoice.getAmountPaid());
        log.info("Payment succeeded for subscription {}: ${} CAD", subscription.getId(), amountPaid);

        if (invoice.getLines() != null && invoice.getLines().getData() != null
                && !invoice.getLines().getData().isEmpty()) {
            InvoiceLineItem line = invoice.getLines().getData().get(0);
            if (line.getPeriod() != null && line.getPeriod().getStart() != null && line.getPeriod().getEnd() != null) {
                subscription.setCurrentPeriodStart(StripeGateway.toDateTime(line.getPeriod().getStart()));
                subscription.setCurrentPeriodEnd(StripeGateway.toDateTime(line.getPeriod().getEnd()));
            }
        }
        if (subscription.getStatus() == SubscriptionStatus.PAST_DUE) {
            subscription.setStatus(SubscriptionStatus.ACTIVE);
        }
        subscriptionRepository.save(subscription);

        if (invoice.getId() != null && billingRecordRepository.existsByStripeInvoiceId(invoice.getId())) {
            log.debug("Billing record for invoice {} already exists", invoice.getId());
            return;
        }
        BillingRecord record = new BillingRecord();
        record.setUserId(subscription.getUserId());
        record.setSubscriptionId(subscription.getId());
        record.setTransactionType(SubscriptionService.TYPE_SUBSCRIPTION_CHARGE);
        record.setDescription("Subscription payment");
        record.setSubtotal(fromCents(invoice.getSubtotal() != null ? invoice.getSubtotal() : invoice.getAmountPaid()));
        record.setTaxAmount(fromCents(invoice.getTax()));
        record.setTotalAmount(amountPaid);
        record.setCurrency("CAD");
        record.setProvince(subscription.getProvince());
        record.setStatus(BillingRecord.STATUS_SUCCEEDED);
        record.setStripeInvoiceId(invoice.getId());
        record.setStripeChargeId(invoice.getCharge());
        record.setStripePaymentIntentId(invoice.getPaymentIntent());
        record.setInvoicePdfUrl(invoice.getInvoicePdf());
        record.setReceiptUrl(invoice.getHostedInvoiceUrl());
        record.setPeriodStart(subscription.getCurrentPeriodStart());
        record.setPeriodEnd(subscription.getCurrentPeriodEnd());
        billingRecordRepository.save(record);
    }

    private void notifyTrialEnding(Subscription subscription, com.stripe.model.Subscription stripeSubscription) {
        LocalDateTime trialEnd = stripeSubscription.getTrialEnd() != null
                ? StripeGateway.toDateTime(stripeSubscription.getTrialEnd())
                : subscription.getTrialEnd();
        String when = trialEnd != null ? " on " + trialEnd.toLocalDate() : " soon";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stripe_subscription_id", stripeSubscription.getId());
        payload.put("plan_id", subscription.getPlanId());
        notificationService.notifySystem(subscription.getUserId(), NotificationType.SYSTEM_UPDATE,
                NotificationPriority.IMPORTANT, null, "Your trial is ending",
                "Your free trial ends" + when + ". Subscribe to keep your premium features.", payload);
    }

    static SubscriptionStatus mapStatus(String stripeStatus) {
        if (stripeStatus == null) {
            return null;
        }
        switch (stripeStatus.toLowerCase(Locale.ROOT)) {
            case "active":
                return SubscriptionStatus.ACTIVE;
            case "trialing":
                return SubscriptionStatus.TRIALING;
            case "past_due":
                return SubscriptionStatus.PAST_DUE;
            case "canceled":
                return SubscriptionStatus.CANCELED;
            case "unpaid":
                return SubscriptionStatus.UNPAID;
            case "incomplete":
            case "incomplete_expired":
                return SubscriptionStatus.INCOMPLETE;
            default:
                return null;
        }
    }

    private <T extends StripeObject> Optional<T> dataObject(Event event, Class<T> type) {
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        StripeObject object = deserializer.getObject().orElse(null);
        if (object == null) {
            // API version of the event differs from the library's pinned version
            try {
                object = deserializer.deserializeUnsafe();
            } catch (EventDataObjectDeserializationException e) {
                log.error("Could not read data object of Stripe event {} ({}): {}",
                        event.getId(), event.getType(), e.getMessage());
                return Optional.empty();
            }
        }
        if (!type.isInstance(object)) {
            log.warn("Stripe event {} carries {} instead of {}", event.getId(),
                    object.getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(object));
    }

    /**
     * @return true if this is the first time the event id is seen
     */
    private boolean markReceived(String eventId) {
        try {
            Boolean first = redisStringTemplate.opsForValue()
                    .setIfAbsent(EVENT_KEY_PREFIX + eventId, "1", EVENT_TTL);
            return !Boolean.FALSE.equals(first);
        } catch (RuntimeException e) {
            log.warn("Webhook idempotency check skipped, Redis unavailable: {}", e.getMessage());
            return true;
        }
    }

    /**
     * Clear the marker when the current transaction ends in anything but a commit,
     * including failures raised while committing.
     *
     * @return false when no transaction synchronization is active
     */
    private boolean forgetUnlessCommitted(String eventId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.warn("Stripe event {} not committed; clearing idempotency marker", eventId);
                    forget(eventId);
                }
            }
        });
        return true;
    }

    private void forget(String eventId) {
        try {
            redisStringTemplate.delete(EVENT_KEY_PREFIX + eventId);
        } catch (RuntimeException e) {
            log.warn("Could not clear idempotency marker for event {}: {}", eventId, e.getMessage());
        }
    }

    private static BigDecimal fromCents(Long cents) {
        if (cents == null) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
        }
        return BigDecimal.valueOf(cents).movePointLeft(2).setScale(2, RoundingMode.UNNECESSARY);
    }

    private static Map<String, Object> result(String status, String key, Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", status);
        result.put(key, value);
        return result;
    }
}
