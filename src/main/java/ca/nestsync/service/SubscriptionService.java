package ca.nestsync.service;

import ca.nestsync.dto.request.SubscribeInput;
import ca.nestsync.dto.response.FeatureAccessCheck;
import ca.nestsync.dto.response.SubscriptionView;
import ca.nestsync.dto.response.TrialProgressView;
import ca.nestsync.entity.BillingRecord;
import ca.nestsync.entity.CanadianTaxRate.Province;
import ca.nestsync.entity.FeatureAccess;
import ca.nestsync.entity.Subscription;
import ca.nestsync.entity.Subscription.SubscriptionStatus;
import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.SubscriptionPlan.BillingInterval;
import ca.nestsync.entity.SubscriptionPlan.SubscriptionTier;
import ca.nestsync.entity.TrialProgress;
import ca.nestsync.entity.TrialUsageEvent;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.BillingException;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.BillingRecordRepository;
import ca.nestsync.repository.FeatureAccessRepository;
import ca.nestsync.repository.SubscriptionPlanRepository;
import ca.nestsync.repository.SubscriptionRepository;
import ca.nestsync.repository.TrialProgressRepository;
import ca.nestsync.repository.TrialUsageEventRepository;
import ca.nestsync.service.StripeGateway.StripeSubscriptionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Subscription lifecycle: trials, paid plans, plan changes, cancellation and
 * the feature access that follows from them.
 *
 * Paid operations call Stripe first and only then write local state, so a
 * Stripe failure leaves the database untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionService {

    static final int TRIAL_DAYS = 14;
    static final int COOLING_OFF_DAYS = 14;
    static final String TYPE_SUBSCRIPTION_CHARGE = "subscription_charge";
    static final String TYPE_TRIAL_CONVERSION = "trial_conversion";
    static final String TYPE_UPGRADE = "upgrade";
    static final String TYPE_DOWNGRADE = "downgrade";
    static final String TYPE_REFUND = "refund";
    private static final int MAX_PAGE_SIZE = 100;

    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final BillingRecordRepository billingRecordRepository;
    private final TrialProgressRepository trialProgressRepository;
    private final TrialUsageEventRepository trialUsageEventRepository;
    private final FeatureAccessRepository featureAccessRepository;
    private final CanadianTaxService taxService;
    private final StripeGateway stripeGateway;

    // ------------------------------------------------------------------ queries

    @Transactional(readOnly = true)
    public List<SubscriptionPlan> getAvailablePlans() {
        return planRepository.findByIsActiveTrueOrderBySortOrderAsc();
    }

    @Transactional(readOnly = true)
    public SubscriptionPlan getPlan(String planId) {
        return planRepository.findByIdAndIsActiveTrue(planId).orElse(null);
    }

    @Transactional(readOnly = true)
    public SubscriptionView getMySubscription(UserProfile user) {
        return subscriptionRepository.findByUserId(user.getId())
                .map(sub -> SubscriptionView.from(sub, now()))
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public TrialProgressView getMyTrialProgress(UserProfile user) {
        return trialProgressRepository.findByUserId(user.getId())
                .map(trial -> TrialProgressView.from(trial, now()))
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public List<BillingRecord> getBillingHistory(UserProfile user, int limit, int offset) {
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return billingRecordRepository.findByUserIdOrderByCreatedAtDesc(user.getId(),
                new OffsetPageRequest(Math.max(0, offset), size));
    }

    @Transactional(readOnly = true)
    public List<FeatureAccess> getMyFeatureAccess(UserProfile user) {
        return featureAccessRepository.findByUserIdOrderByFeatureIdAsc(user.getId());
    }

    /**
     * Whether the user may use a feature, with an upgrade hint when not.
     */
    @Transactional(readOnly = true)
    public FeatureAccessCheck checkFeatureAccess(UserProfile user, String featureId) {
        Optional<FeatureAccess> record = featureAccessRepository.findByUserIdAndFeatureId(user.getId(), featureId);
        if (record.isEmpty()) {
            return FeatureAccessCheck.builder()
                    .featureId(featureId)
                    .hasAccess(false)
                    .tierRequired(SubscriptionTier.STANDARD)
                    .upgradeRecommendation("Upgrade to access " + FeatureAccess.displayName(featureId))
                    .build();
        }

        FeatureAccess access = record.get();
        boolean usable = access.isUsable(now());
        return FeatureAccessCheck.builder()
                .featureId(featureId)
                .hasAccess(usable)
                .tierRequired(access.getTierRequired())
                .accessSource(access.getAccessSource())
                .accessExpiresAt(access.getAccessExpiresAt())
                .upgradeRecommendation(usable ? null
                        : "Upgrade to " + titleCase(access.getTierRequired().name()) + " plan to access this feature")
                .build();
    }

    // ---------------------------------------------------------------- mutations

    /**
     * Start a free trial on the monthly plan of a paid tier. Each user gets one trial.
     */
    @Transactional
    public SubscriptionView startTrial(UserProfile user, SubscriptionTier tier, Province province) {
        if (tier == null || tier == SubscriptionTier.FREE) {
            throw new IllegalArgumentException("Trials are only available for paid plans");
        }
        if (subscriptionRepository.findByUserId(user.getId()).isPresent()) {
            throw new IllegalStateException("You already have an active subscription");
        }
        if (trialProgressRepository.existsByUserId(user.getId())) {
            throw new IllegalStateException("Trial already used. Please subscribe to continue.");
        }
        SubscriptionPlan plan = planRepository.findFirstByTierAndBillingIntervalAndIsActiveTrue(tier, BillingInterval.MONTHLY)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription plan not found"));

        LocalDateTime now = now();
        LocalDateTime trialEnd = now.plusDays(TRIAL_DAYS);

        Subscription subscription = new Subscription();
        subscription.setUserId(user.getId());
        subscription.setPlanId(plan.getId());
        subscription.setTier(plan.getTier());
        subscription.setStatus(SubscriptionStatus.TRIALING);
        subscription.setBillingInterval(plan.getBillingInterval());
        subscription.setAmount(plan.getPrice());
        subscription.setCurrency("CAD");
        subscription.setProvince(province != null ? province : provinceOf(user));
        subscription.setTrialStart(now);
        subscription.setTrialEnd(trialEnd);
        subscription.setCurrentPeriodStart(now);
        subscription.setCurrentPeriodEnd(trialEnd);
        subscription = subscriptionRepository.save(subscription);

        TrialProgress trial = new TrialProgress();
        trial.setUserId(user.getId());
        trial.setSubscriptionId(subscription.getId());
        trial.setIsActive(true);
        trial.setTrialTier(plan.getTier());
        trial.setTrialStartedAt(now);
        trial.setTrialEndsAt(trialEnd);
        trial.setLastActivityAt(now);
        trial = trialProgressRepository.save(trial);

        grantFeatures(user, subscription, plan, FeatureAccess.SOURCE_TRIAL, trialEnd, now);
        trialUsageEventRepository.save(new TrialUsageEvent(trial.getId(), user.getId(), "trial_started",
                "Started " + TRIAL_DAYS + "-day " + plan.getDisplayName() + " trial"));

        log.info("User {} started a {} trial ending {}", user.getId(), tier, trialEnd);
        return SubscriptionView.from(subscription, now);
    }

    /**
     * Subscribe to a paid plan through Stripe. Converts an active trial and
     * records the first charge with its tax breakdown.
     */
    @Transactional
    public SubscriptionView subscribe(UserProfile user, SubscribeInput input) {
        SubscriptionPlan plan = planRepository.findByIdAndIsActiveTrue(input.getPlanId())
                .orElseThrow(() -> new ResourceNotFoundException("Subscription plan not found"));
        if (plan.getTier() == SubscriptionTier.FREE || plan.getStripePriceId() == null) {
            throw new IllegalArgumentException("This plan cannot be purchased");
        }

        Subscription subscription = subscriptionRepository.findByUserId(user.getId()).orElseGet(Subscription::new);
        if (subscription.getStatus() == SubscriptionStatus.ACTIVE && plan.getId().equals(subscription.getPlanId())) {
            throw new IllegalStateException("You are already subscribed to this plan");
        }
        boolean wasTrialing = subscription.getStatus() == SubscriptionStatus.TRIALING;

        StripeSubscriptionSnapshot stripe;
        try {
            String customerId = stripeGateway.ensureCustomer(subscription.getStripeCustomerId(), user.getEmail(),
                    user.getId().toString(), input.getPaymentMethodId());
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("user_id", user.getId().toString());
            metadata.put("plan_id", plan.getId());
            metadata.put("province", input.getProvince().name());
            stripe = stripeGateway.createSubscription(customerId, plan.getStripePriceId(),
                    input.getPaymentMethodId(), metadata);
        } catch (BillingException e) {
            throw BillingException.failed(e.getOperation(), "Failed to create subscription. Please try again.", e);
        }

        LocalDateTime now = now();
        subscription.setUserId(user.getId());
        subscription.setPlanId(plan.getId());
        subscription.setTier(plan.getTier());
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setBillingInterval(plan.getBillingInterval());
        subscription.setAmount(plan.getPrice());
        subscription.setCurrency("CAD");
        subscription.setProvince(input.getProvince());
        subscription.setStripeCustomerId(stripe.customerId());
        subscription.setStripeSubscriptionId(stripe.id());
        subscription.setCurrentPeriodStart(stripe.currentPeriodStart() != null ? stripe.currentPeriodStart() : now);
        subscription.setCurrentPeriodEnd(stripe.currentPeriodEnd() != null
                ? stripe.currentPeriodEnd() : periodEnd(now, plan.getBillingInterval()));
        subscription.setTrialStart(null);
        subscription.setTrialEnd(null);
        subscription.setCancelAtPeriodEnd(false);
        subscription.setCanceledAt(null);
        subscription.setCancellationReason(null);
        subscription.setCoolingOffEnd(plan.getBillingInterval() == BillingInterval.YEARLY
                ? now.plusDays(COOLING_OFF_DAYS) : null);
        subscription.setPaymentConsentAt(now);
        subscription = subscriptionRepository.save(subscription);

        boolean convertedTrial = convertTrial(user, plan, now);
        grantFeatures(user, subscription, plan, FeatureAccess.SOURCE_SUBSCRIPTION, null, now);

        BillingRecord record = newRecord(user, subscription,
                wasTrialing || convertedTrial ? TYPE_TRIAL_CONVERSION : TYPE_SUBSCRIPTION_CHARGE,
                "Subscription to " + plan.getDisplayName());
        record.applyTax(taxService.calculate(plan.getPrice(), input.getProvince()));
        record.setStripeInvoiceId(stripe.latestInvoiceId());
        record.setPeriodStart(subscription.getCurrentPeriodStart());
        record.setPeriodEnd(subscription.getCurrentPeriodEnd());
        billingRecordRepository.save(record);

        log.info("User {} subscribed to {} (stripe subscription {})", user.getId(), plan.getId(), stripe.id());
        return SubscriptionView.from(subscription, now);
    }

    @Transactional
    public SubscriptionView changePlan(UserProfile user, String newPlanId) {
        Subscription subscription = subscriptionRepository.findByUserId(user.getId())
                .filter(Subscription::isLive)
                .orElseThrow(() -> new IllegalStateException("No active subscription found"));
        SubscriptionPlan newPlan = planRepository.findByIdAndIsActiveTrue(newPlanId)
                .orElseThrow(() -> new ResourceNotFoundException("New plan not found"));
        if (newPlan.getId().equals(subscription.getPlanId())) {
            throw new IllegalStateException("New plan is the same as current plan");
        }
        SubscriptionPlan currentPlan = planRepository.findById(subscription.getPlanId())
                .orElseThrow(() -> new ResourceNotFoundException("Subscription plan not found"));

        if (subscription.getStripeSubscriptionId() != null) {
            if (newPlan.getStripePriceId() == null) {
                throw new IllegalArgumentException("This plan cannot be purchased");
            }
            try {
                StripeSubscriptionSnapshot stripe = stripeGateway.changePrice(
                        subscription.getStripeSubscriptionId(), newPlan.getStripePriceId());
                if (stripe.currentPeriodEnd() != null) {
                    subscription.setCurrentPeriodStart(stripe.currentPeriodStart());
                    subscription.setCurrentPeriodEnd(stripe.currentPeriodEnd());
                }
            } catch (BillingException e) {
                throw BillingException.failed(e.getOperation(), "Failed to update subscription with Stripe", e);
            }
        }

        boolean upgrade = isUpgrade(currentPlan, newPlan);
        LocalDateTime now = now();
        subscription.setPlanId(newPlan.getId());
        subscription.setTier(newPlan.getTier());
        subscription.setBillingInterval(newPlan.getBillingInterval());
        subscription.setAmount(newPlan.getPrice());
        subscription = subscriptionRepository.save(subscription);

        LocalDateTime expiresAt = subscription.getStatus() == SubscriptionStatus.TRIALING ? subscription.getTrialEnd() : null;
        String source = subscription.getStatus() == SubscriptionStatus.TRIALING
                ? FeatureAccess.SOURCE_TRIAL : FeatureAccess.SOURCE_SUBSCRIPTION;
        grantFeatures(user, subscription, newPlan, source, expiresAt, now);

        BillingRecord record = newRecord(user, subscription, upgrade ? TYPE_UPGRADE : TYPE_DOWNGRADE,
                "Plan change: " + currentPlan.getDisplayName() + " → " + newPlan.getDisplayName());
        record.applyTax(taxService.calculate(newPlan.getPrice(), provinceOf(subscription, user)));
        billingRecordRepository.save(record);

        log.info("User {} changed plan {} -> {} ({})", user.getId(), currentPlan.getId(), newPlan.getId(),
                upgrade ? TYPE_UPGRADE : TYPE_DOWNGRADE);
        return SubscriptionView.from(subscription, now);
    }

    /**
     * Cancel the subscription. Inside the cooling-off period a refund request
     * refunds the last charge and ends the subscription at once; otherwise it
     * runs to the end of the paid period.
     */
    @Transactional
    public SubscriptionView cancel(UserProfile user, String reason, boolean requestRefund) {
        Subscription subscription = subscriptionRepository.findByUserId(user.getId())
                .filter(Subscription::isLive)
                .orElseThrow(() -> new IllegalStateException("No active subscription found"));

        LocalDateTime now = now();
        boolean refund = requestRefund && subscription.isInCoolingOffPeriod(now);
        if (requestRefund && !refund) {
            log.info("Refund requested by user {} outside the cooling-off period", user.getId());
        }

        if (subscription.getStripeSubscriptionId() != null) {
            try {
                if (refund) {
                    Optional<BillingRecord> lastCharge = billingRecordRepository
                            .findFirstBySubscriptionIdAndStatusAndRefundedFalseAndStripeChargeIdIsNotNullOrderByCreatedAtDesc(
                                    subscription.getId(), BillingRecord.STATUS_SUCCEEDED);
                    if (lastCharge.isPresent()) {
                        stripeGateway.refundCharge(lastCharge.get().getStripeChargeId());
                        lastCharge.get().markRefunded("Cooling-off period cancellation", now);
                        billingRecordRepository.save(lastCharge.get());
                    } else {
                        log.warn("No refundable charge found for subscription {}", subscription.getId());
                    }
                }
                stripeGateway.cancel(subscription.getStripeSubscriptionId(), refund);
            } catch (BillingException e) {
                throw BillingException.failed(e.getOperation(), "Failed to cancel subscription. Please try again.", e);
            }
        }

        subscription.setStatus(SubscriptionStatus.CANCELED);
        subscription.setCanceledAt(now);
        subscription.setCancellationReason(reason);
        subscription.setCancelAtPeriodEnd(!refund && subscription.getStripeSubscriptionId() != null);
        subscription = subscriptionRepository.save(subscription);

        trialProgressRepository.findByUserId(user.getId())
                .filter(trial -> Boolean.TRUE.equals(trial.getIsActive()))
                .ifPresent(trial -> {
                    trial.markCanceled(now);
                    trialProgressRepository.save(trial);
                });

        List<FeatureAccess> features = featureAccessRepository.findByUserIdOrderByFeatureIdAsc(user.getId());
        for (FeatureAccess feature : features) {
            feature.setHasAccess(false);
            feature.setAccessExpiresAt(now);
        }
        featureAccessRepository.saveAll(features);

        BillingRecord record = newRecord(user, subscription, refund ? TYPE_REFUND : TYPE_SUBSCRIPTION_CHARGE,
                "Subscription canceled: " + (reason != null && !reason.isBlank() ? reason : "No reason provided"));
        record.setProvince(subscription.getProvince());
        billingRecordRepository.save(record);

        log.info("User {} canceled subscription {} (refund={})", user.getId(), subscription.getId(), refund);
        return SubscriptionView.from(subscription, now);
    }

    @Transactional
    public SubscriptionView updateBillingProvince(UserProfile user, Province province) {
        Subscription subscription = subscriptionRepository.findByUserId(user.getId())
                .orElseThrow(() -> new IllegalStateException("No active subscription found"));
        Province previous = subscription.getProvince();
        if (previous == province) {
            throw new IllegalStateException("Province is already set to " + province.name());
        }

        subscription.setProvince(province);
        subscription = subscriptionRepository.save(subscription);

        BillingRecord record = newRecord(user, subscription, TYPE_SUBSCRIPTION_CHARGE,
                "Billing province changed: " + (previous != null ? previous.name() : "none") + " → " + province.name());
        record.setProvince(province);
        billingRecordRepository.save(record);

        log.info("Billing province for user {} changed {} -> {}", user.getId(), previous, province);
        return SubscriptionView.from(subscription, now());
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Replace the user's feature access with one row per plan feature.
     */
    private void grantFeatures(UserProfile user, Subscription subscription, SubscriptionPlan plan,
                               String source, LocalDateTime expiresAt, LocalDateTime now) {
        featureAccessRepository.deleteAllForUser(user.getId());
        List<FeatureAccess> rows = plan.getFeatures().stream()
                .map(featureId -> {
                    FeatureAccess access = new FeatureAccess();
                    access.setUserId(user.getId());
                    access.setSubscriptionId(subscription.getId());
                    access.setFeatureId(featureId);
                    access.setFeatureName(FeatureAccess.displayName(featureId));
                    access.setTierRequired(plan.getTier());
                    access.setHasAccess(true);
                    access.setAccessSource(source);
                    access.setAccessGrantedAt(now);
                    access.setAccessExpiresAt(expiresAt);
                    return access;
                })
                .toList();
        featureAccessRepository.saveAll(rows);
    }

    private boolean convertTrial(UserProfile user, SubscriptionPlan plan, LocalDateTime now) {
        Optional<TrialProgress> active = trialProgressRepository.findByUserId(user.getId())
                .filter(trial -> Boolean.TRUE.equals(trial.getIsActive()));
        if (active.isEmpty()) {
            return false;
        }
        TrialProgress trial = active.get();
        trial.markConverted(plan.getId(), now);
        trialProgressRepository.save(trial);
        trialUsageEventRepository.save(new TrialUsageEvent(trial.getId(), user.getId(), "trial_converted",
                "Converted to " + plan.getDisplayName()));
        log.info("Trial {} of user {} converted to {}", trial.getId(), user.getId(), plan.getId());
        return true;
    }

    static boolean isUpgrade(SubscriptionPlan current, SubscriptionPlan next) {
        int byTier = Integer.compare(next.getTier().getRank(), current.getTier().getRank());
        if (byTier != 0) {
            return byTier > 0;
        }
        return next.getPrice().compareTo(current.getPrice()) > 0;
    }

    private BillingRecord newRecord(UserProfile user, Subscription subscription, String type, String description) {
        BillingRecord record = new BillingRecord();
        record.setUserId(user.getId());
        record.setSubscriptionId(subscription.getId());
        record.setTransactionType(type);
        record.setDescription(description);
        record.setSubtotal(BigDecimal.ZERO);
        record.setTaxAmount(BigDecimal.ZERO);
        record.setTotalAmount(BigDecimal.ZERO);
        record.setCurrency("CAD");
        record.setStatus(BillingRecord.STATUS_SUCCEEDED);
        return record;
    }

    private Province provinceOf(Subscription subscription, UserProfile user) {
        return subscription.getProvince() != null ? subscription.getProvince() : provinceOf(user);
    }

    /**
     * Province from the user's profile, Ontario when unset.
     */
    private Province provinceOf(UserProfile user) {
        if (user.getProvince() == null) {
            return Province.ON;
        }
        try {
            return Province.valueOf(user.getProvince().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown province '{}' on profile of user {}; using ON", user.getProvince(), user.getId());
            return Province.ON;
        }
    }

    private static LocalDateTime periodEnd(LocalDateTime start, BillingInterval interval) {
        return interval == BillingInterval.YEARLY ? start.plusYears(1) : start.plusMonths(1);
    }

    private static String titleCase(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
