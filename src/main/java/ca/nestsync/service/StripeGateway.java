package ca.nestsync.service;

import ca.nestsync.exception.BillingException;
import com.stripe.Stripe;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Refund;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerUpdateParams;
import com.stripe.param.PaymentMethodAttachParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.SubscriptionCreateParams;
import com.stripe.param.SubscriptionUpdateParams;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Thin wrapper over the Stripe SDK.
 *
 * Every call is logged and any {@link StripeException} is rethrown as a
 * {@link BillingException} naming the operation. Without an API key every
 * call fails with {@link BillingException#notConfigured()}.
 *
 * @see com.stripe.Stripe
 */
@Service
@Slf4j
public class StripeGateway {

    @Value("${app.stripe.secret-key:}")
    private String secretKey;

    @PostConstruct
    void configure() {
        if (isConfigured()) {
            Stripe.apiKey = secretKey;
            log.info("Stripe client configured ({} mode)", secretKey.startsWith("sk_live") ? "live" : "test");
        } else {
            log.warn("Stripe secret key not set; billing operations are disabled");
        }
    }

    public boolean isConfigured() {
        return secretKey != null && !secretKey.isBlank();
    }

    /**
     * Return a customer with the payment method attached as default, creating
     * the customer when {@code existingCustomerId} is null.
     *
     * @return the Stripe customer id
     */
    public String ensureCustomer(String existingCustomerId, String email, String userId, String paymentMethodId) {
        requireConfigured();
        try {
            if (existingCustomerId == null) {
                Customer customer = Customer.create(CustomerCreateParams.builder()
                        .setEmail(email)
                        .setPaymentMethod(paymentMethodId)
                        .setInvoiceSettings(CustomerCreateParams.InvoiceSettings.builder()
                                .setDefaultPaymentMethod(paymentMethodId)
                                .build())
                        .putMetadata("user_id", userId)
                        .build());
                log.info("Created Stripe customer {} for user {}", customer.getId(), userId);
                return customer.getId();
            }

            PaymentMethod.retrieve(paymentMethodId)
                    .attach(PaymentMethodAttachParams.builder().setCustomer(existingCustomerId).build());
            Customer.retrieve(existingCustomerId).update(CustomerUpdateParams.builder()
                    .setInvoiceSettings(CustomerUpdateParams.InvoiceSettings.builder()
                            .setDefaultPaymentMethod(paymentMethodId)
                            .build())
                    .build());
            log.info("Reusing Stripe customer {} for user {}", existingCustomerId, userId);
            return existingCustomerId;
        } catch (StripeException e) {
            log.error("Stripe customer setup failed for user {}: {}", userId, e.getMessage(), e);
            throw BillingException.stripeFailure("ensure_customer", e);
        }
    }

    public StripeSubscriptionSnapshot createSubscription(String customerId, String priceId, String paymentMethodId,
                                                         Map<String, String> metadata) {
        requireConfigured();
        try {
            Subscription subscription = Subscription.create(SubscriptionCreateParams.builder()
                    .setCustomer(customerId)
                    .addItem(SubscriptionCreateParams.Item.builder().setPrice(priceId).build())
                    .setDefaultPaymentMethod(paymentMethodId)
                    .putAllMetadata(metadata)
                    .build());
            log.info("Created Stripe subscription {} for customer {}", subscription.getId(), customerId);
            return snapshot(subscription);
        } catch (StripeException e) {
            log.error("Stripe subscription creation failed for customer {}: {}", customerId, e.getMessage(), e);
            throw BillingException.stripeFailure("create_subscription", e);
        }
    }

    /**
     * Move the subscription's single item to a new price, prorating the difference.
     */
    public StripeSubscriptionSnapshot changePrice(String subscriptionId, String newPriceId) {
        requireConfigured();
        try {
            Subscription subscription = Subscription.retrieve(subscriptionId);
            SubscriptionItem item = subscription.getItems().getData().get(0);
            Subscription updated = subscription.update(SubscriptionUpdateParams.builder()
                    .addItem(SubscriptionUpdateParams.Item.builder()
                            .setId(item.getId())
                            .setPrice(newPriceId)
                            .build())
                    .setProrationBehavior(SubscriptionUpdateParams.ProrationBehavior.CREATE_PRORATIONS)
                    .build());
            log.info("Stripe subscription {} moved to price {}", subscriptionId, newPriceId);
            return snapshot(updated);
        } catch (StripeException e) {
            log.error("Stripe price change failed for subscription {}: {}", subscriptionId, e.getMessage(), e);
            throw BillingException.stripeFailure("change_price", e);
        }
    }

    /**
     * Cancel now, or flag the subscription to end with the current period.
     */
    public StripeSubscriptionSnapshot cancel(String subscriptionId, boolean immediately) {
        requireConfigured();
        try {
            Subscription subscription = Subscription.retrieve(subscriptionId);
            Subscription result = immediately
                    ? subscription.cancel()
                    : subscription.update(SubscriptionUpdateParams.builder().setCancelAtPeriodEnd(true).build());
            log.info("Stripe subscription {} canceled ({})", subscriptionId, immediately ? "immediately" : "at period end");
            return snapshot(result);
        } catch (StripeException e) {
            log.error("Stripe cancellation failed for subscription {}: {}", subscriptionId, e.getMessage(), e);
            throw BillingException.stripeFailure("cancel_subscription", e);
        }
    }

    /**
     * Refund a charge in full.
     *
     * @return the Stripe refund id
     */
    public String refundCharge(String chargeId) {
        requireConfigured();
        try {
            Refund refund = Refund.create(RefundCreateParams.builder()
                    .setCharge(chargeId)
                    .setReason(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER)
                    .build());
            log.info("Refunded charge {} (refund {})", chargeId, refund.getId());
            return refund.getId();
        } catch (StripeException e) {
            log.error("Stripe refund failed for charge {}: {}", chargeId, e.getMessage(), e);
            throw BillingException.stripeFailure("refund", e);
        }
    }

    static StripeSubscriptionSnapshot snapshot(Subscription subscription) {
        return new StripeSubscriptionSnapshot(
                subscription.getId(),
                subscription.getCustomer(),
                subscription.getStatus(),
                toDateTime(subscription.getCurrentPeriodStart()),
                toDateTime(subscription.getCurrentPeriodEnd()),
                Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd()),
                toDateTime(subscription.getCanceledAt()),
                subscription.getLatestInvoice());
    }

    static LocalDateTime toDateTime(Long epochSeconds) {
        return epochSeconds == null ? null : LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw BillingException.notConfigured();
        }
    }

    /**
     * The fields of a Stripe subscription the application keeps.
     */
    public record StripeSubscriptionSnapshot(
            String id,
            String customerId,
            String status,
            LocalDateTime currentPeriodStart,
            LocalDateTime currentPeriodEnd,
            boolean cancelAtPeriodEnd,
            LocalDateTime canceledAt,
            String latestInvoiceId
    ) {
    }
}
