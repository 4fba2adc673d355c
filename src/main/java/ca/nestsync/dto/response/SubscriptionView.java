package ca.nestsync.dto.response;

import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.Subscription;
import ca.nestsync.entity.SubscriptionPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Subscription as exposed to its owner; Stripe identifiers stay server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionView {

    private UUID id;
    private String planId;
    private SubscriptionPlan.SubscriptionTier tier;
    private Subscription.SubscriptionStatus status;
    private SubscriptionPlan.BillingInterval billingInterval;
    private BigDecimal amount;
    private String currency;
    private CanadianTaxRate.Province province;
    private LocalDateTime trialStart;
    private LocalDateTime trialEnd;
    private LocalDateTime currentPeriodStart;
    private LocalDateTime currentPeriodEnd;
    private boolean cancelAtPeriodEnd;
    private LocalDateTime canceledAt;
    private LocalDateTime coolingOffEnd;
    private Boolean isInCoolingOffPeriod;
    private LocalDateTime createdAt;

    public static SubscriptionView from(Subscription subscription, LocalDateTime now) {
        return SubscriptionView.builder()
                .id(subscription.getId())
                .planId(subscription.getPlanId())
                .tier(subscription.getTier())
                .status(subscription.getStatus())
                .billingInterval(subscription.getBillingInterval())
                .amount(subscription.getAmount())
                .currency(subscription.getCurrency())
                .province(subscription.getProvince())
                .trialStart(subscription.getTrialStart())
                .trialEnd(subscription.getTrialEnd())
                .currentPeriodStart(subscription.getCurrentPeriodStart())
                .currentPeriodEnd(subscription.getCurrentPeriodEnd())
                .cancelAtPeriodEnd(Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd()))
                .canceledAt(subscription.getCanceledAt())
                .coolingOffEnd(subscription.getCoolingOffEnd())
                .isInCoolingOffPeriod(subscription.isInCoolingOffPeriod(now))
                .createdAt(subscription.getCreatedAt())
                .build();
    }
}
