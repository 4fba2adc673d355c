package ca.nestsync.service;

import ca.nestsync.dto.request.SubscribeInput;
import ca.nestsync.dto.response.FeatureAccessCheck;
import ca.nestsync.dto.response.SubscriptionView;
import ca.nestsync.entity.BillingRecord;
import ca.nestsync.entity.CanadianTaxRate.Province;
import ca.nestsync.entity.CanadianTaxRate.TaxType;
import ca.nestsync.entity.FeatureAccess;
import ca.nestsync.entity.Subscription;
import ca.nestsync.entity.Subscription.SubscriptionStatus;
import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.SubscriptionPlan.BillingInterval;
import ca.nestsync.entity.SubscriptionPlan.SubscriptionTier;
import ca.nestsync.entity.TaxBreakdown;
import ca.nestsync.entity.TrialProgress;
import ca.nestsync.entity.TrialUsageEvent;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.BillingException;
import ca.nestsync.repository.BillingRecordRepository;
import ca.nestsync.repository.FeatureAccessRepository;
import ca.nestsync.repository.SubscriptionPlanRepository;
import ca.nestsync.repository.SubscriptionRepository;
import ca.nestsync.repository.TrialProgressRepository;
import ca.nestsync.repository.TrialUsageEventRepository;
import ca.nestsync.service.StripeGateway.StripeSubscriptionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SubscriptionService.
 *
 * Tests the subscription lifecycle:
 * - Trial start and the one-trial-per-user rule
 * - Paid subscription through Stripe, with trial conversion and tax
 * - Plan changes, cancellation with and without cooling-off refund
 * - Feature access checks and billing province changes
 *
 * @see ca.nestsync.service.SubscriptionService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriptionService Unit Tests")
class SubscriptionServiceTest {

    @Mock
    private SubscriptionPlanRepository planRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private BillingRecordRepository billingRecordRepository;

    @Mock
    private TrialProgressRepository trialProgressRepository;

    @Mock
    private TrialUsageEventRepository trialUsageEventRepository;

    @Mock
    private FeatureAccessRepository featureAccessRepository;

    @Mock
    private CanadianTaxService taxService;

    @Mock
    private StripeGateway stripeGateway;

    @InjectMocks
    private SubscriptionService subscriptionService;

    private UserProfile user;
    private SubscriptionPlan standardMonthly;
    private SubscriptionPlan premiumMonthly;
    private SubscriptionPlan premiumYearly;

    @BeforeEach
    void setUp() {
        user = new UserProfile();
        user.setId(UUID.randomUUID());
        user.setEmail("parent@example.ca");
        user.setProvince("ON");

        standardMonthly = plan("standard_monthly", "Standard Plan", SubscriptionTier.STANDARD, "4.99",
                BillingInterval.MONTHLY, List.of("family_sharing", "reorder_suggestions", "basic_analytics"));
        premiumMonthly = plan("premium_monthly", "Premium Plan", SubscriptionTier.PREMIUM, "6.99",
                BillingInterval.MONTHLY, List.of("family_sharing", "price_alerts", "automation"));
        premiumYearly = plan("premium_yearly", "Premium Plan (Annual)", SubscriptionTier.PREMIUM, "69.99",
                BillingInterval.YEARLY, List.of("family_sharing", "price_alerts", "automation"));
    }

    private static SubscriptionPlan plan(String id, String displayName, SubscriptionTier tier, String price,
                                         BillingInterval interval, List<String> features) {
        return SubscriptionPlan.builder()
                .id(id)
                .name(displayName)
                .displayName(displayName)
                .tier(tier)
                .price(new BigDecimal(price))
                .billingInterval(interval)
                .features(features)
                .stripePriceId("price_" + id)
                .build();
    }

    private static TaxBreakdown ontarioTax(String subtotal, String hst, String total) {
        return new TaxBreakdown(Province.ON, TaxType.HST, new BigDecimal(subtotal), BigDecimal.ZERO,
                BigDecimal.ZERO, new BigDecimal(hst), BigDecimal.ZERO, new BigDecimal(hst),
                new BigDecimal(total), new BigDecimal("0.13"));
    }

    private void saveSubscriptionsWithIds() {
        when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(invocation -> {
            Subscription subscription = invocation.getArgument(0);
            if (subscription.getId() == null) {
                subscription.setId(UUID.randomUUID());
            }
            return subscription;
        });
    }

    private Subscription activeSubscription(SubscriptionPlan plan) {
        Subscription subscription = new Subscription();
        subscription.setId(UUID.randomUUID());
        subscription.setUserId(user.getId());
        subscription.setPlanId(plan.getId());
        subscription.setTier(plan.getTier());
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setBillingInterval(plan.getBillingInterval());
        subscription.setAmount(plan.getPrice());
        subscription.setProvince(Province.ON);
        subscription.setStripeSubscriptionId("sub_123");
        subscription.setStripeCustomerId("cus_123");
        return subscription;
    }

    @Test
    @DisplayName("Starting a trial creates a trialing subscription, progress, features and a usage event")
    void testStartTrial() {
        // Arrange
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(trialProgressRepository.existsByUserId(user.getId())).thenReturn(false);
        when(planRepository.findFirstByTierAndBillingIntervalAndIsActiveTrue(SubscriptionTier.STANDARD, BillingInterval.MONTHLY))
                .thenReturn(Optional.of(standardMonthly));
        saveSubscriptionsWithIds();
        when(trialProgressRepository.save(any(TrialProgress.class))).thenAnswer(invocation -> {
            TrialProgress trial = invocation.getArgument(0);
            trial.setId(UUID.randomUUID());
            return trial;
        });

        // Act
        SubscriptionView view = subscriptionService.startTrial(user, SubscriptionTier.STANDARD, null);

        // Assert
        assertEquals(SubscriptionStatus.TRIALING, view.getStatus());
        assertEquals("CAD", view.getCurrency());
        assertEquals(Province.ON, view.getProvince());
        assertEquals(view.getTrialEnd(), view.getCurrentPeriodEnd());
        assertEquals(14, Duration.between(view.getTrialStart(), view.getTrialEnd()).toDays());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<FeatureAccess>> features = ArgumentCaptor.forClass(List.class);
        verify(featureAccessRepository).deleteAllForUser(user.getId());
        verify(featureAccessRepository).saveAll(features.capture());
        assertEquals(3, features.getValue().size());
        FeatureAccess first = features.getValue().get(0);
        assertEquals(FeatureAccess.SOURCE_TRIAL, first.getAccessSource());
        assertEquals("Family Sharing", first.getFeatureName());
        assertEquals(view.getTrialEnd(), first.getAccessExpiresAt());

        ArgumentCaptor<TrialUsageEvent> event = ArgumentCaptor.forClass(TrialUsageEvent.class);
        verify(trialUsageEventRepository).save(event.capture());
        assertEquals("trial_started", event.getValue().getEventType());
    }

    @Test
    @DisplayName("A second trial is refused")
    void testTrialAlreadyUsed() {
        // Arrange
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(trialProgressRepository.existsByUserId(user.getId())).thenReturn(true);

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> subscriptionService.startTrial(user, SubscriptionTier.PREMIUM, Province.ON));
        assertEquals("Trial already used. Please subscribe to continue.", ex.getMessage());
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    @DisplayName("A trial is refused while a subscription exists")
    void testTrialWithExistingSubscription() {
        // Arrange
        when(subscriptionRepository.findByUserId(user.getId()))
                .thenReturn(Optional.of(activeSubscription(standardMonthly)));

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> subscriptionService.startTrial(user, SubscriptionTier.STANDARD, Province.ON));
        assertEquals("You already have an active subscription", ex.getMessage());
    }

    @Test
    @DisplayName("Subscribing to a yearly plan converts the trial, opens cooling-off and records taxed charge")
    void testSubscribeYearlyConvertsTrial() {
        // Arrange
        Subscription trialing = activeSubscription(premiumMonthly);
        trialing.setStatus(SubscriptionStatus.TRIALING);
        trialing.setStripeSubscriptionId(null);
        trialing.setStripeCustomerId(null);
        TrialProgress trial = new TrialProgress();
        trial.setId(UUID.randomUUID());
        trial.setIsActive(true);

        LocalDateTime periodStart = LocalDateTime.now(ZoneOffset.UTC);
        StripeSubscriptionSnapshot snapshot = new StripeSubscriptionSnapshot("sub_new", "cus_new", "active",
                periodStart, periodStart.plusYears(1), false, null, "in_001");

        when(planRepository.findByIdAndIsActiveTrue("premium_yearly")).thenReturn(Optional.of(premiumYearly));
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.of(trialing));
        when(stripeGateway.ensureCustomer(isNull(), eq("parent@example.ca"), eq(user.getId().toString()), eq("pm_1")))
                .thenReturn("cus_new");
        when(stripeGateway.createSubscription(eq("cus_new"), eq("price_premium_yearly"), eq("pm_1"), anyMap()))
                .thenReturn(snapshot);
        saveSubscriptionsWithIds();
        when(trialProgressRepository.findByUserId(user.getId())).thenReturn(Optional.of(trial));
        when(taxService.calculate(new BigDecimal("69.99"), Province.ON))
                .thenReturn(ontarioTax("69.99", "9.10", "79.09"));

        // Act
        SubscriptionView view = subscriptionService.subscribe(user,
                new SubscribeInput("premium_yearly", "pm_1", Province.ON));

        // Assert
        assertEquals(SubscriptionStatus.ACTIVE, view.getStatus());
        assertEquals("premium_yearly", view.getPlanId());
        assertNotNull(view.getCoolingOffEnd());
        assertTrue(view.getIsInCoolingOffPeriod());
        assertNull(view.getTrialEnd());
        assertTrue(trial.getConvertedToPaid());
        assertEquals("premium_yearly", trial.getConversionPlanId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(stripeGateway).createSubscription(eq("cus_new"), eq("price_premium_yearly"), eq("pm_1"), metadata.capture());
        assertEquals(user.getId().toString(), metadata.getValue().get("user_id"));
        assertEquals("premium_yearly", metadata.getValue().get("plan_id"));
        assertEquals("ON", metadata.getValue().get("province"));

        ArgumentCaptor<BillingRecord> record = ArgumentCaptor.forClass(BillingRecord.class);
        verify(billingRecordRepository).save(record.capture());
        assertEquals(SubscriptionService.TYPE_TRIAL_CONVERSION, record.getValue().getTransactionType());
        assertEquals("Subscription to Premium Plan (Annual)", record.getValue().getDescription());
        assertEquals(new BigDecimal("79.09"), record.getValue().getTotalAmount());
        assertEquals(new BigDecimal("9.10"), record.getValue().getHstAmount());
        assertEquals("in_001", record.getValue().getStripeInvoiceId());
    }

    @Test
    @DisplayName("A Stripe failure during subscribe leaves local state untouched")
    void testSubscribeStripeFailure() {
        // Arrange
        when(planRepository.findByIdAndIsActiveTrue("standard_monthly")).thenReturn(Optional.of(standardMonthly));
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(stripeGateway.ensureCustomer(any(), any(), any(), any()))
                .thenThrow(new BillingException("ensure_customer", "STRIPE_ERROR", "card declined", null));

        // Act & Assert
        BillingException ex = assertThrows(BillingException.class, () -> subscriptionService.subscribe(user,
                new SubscribeInput("standard_monthly", "pm_1", Province.ON)));
        assertEquals("Failed to create subscription. Please try again.", ex.getMessage());
        verify(subscriptionRepository, never()).save(any());
        verifyNoInteractions(billingRecordRepository);
    }

    @Test
    @DisplayName("The free plan cannot be purchased")
    void testSubscribeFreePlanRejected() {
        // Arrange
        SubscriptionPlan free = plan("free", "Free Plan", SubscriptionTier.FREE, "0.00",
                BillingInterval.MONTHLY, List.of());
        free.setStripePriceId(null);
        when(planRepository.findByIdAndIsActiveTrue("free")).thenReturn(Optional.of(free));

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> subscriptionService.subscribe(user,
                new SubscribeInput("free", "pm_1", Province.ON)));
        verifyNoInteractions(stripeGateway);
    }

    @Test
    @DisplayName("Changing from Standard to Premium is an upgrade billed at the new price")
    void testChangePlanUpgrade() {
        // Arrange
        Subscription subscription = activeSubscription(standardMonthly);
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.of(subscription));
        when(planRepository.findByIdAndIsActiveTrue("premium_monthly")).thenReturn(Optional.of(premiumMonthly));
        when(planRepository.findById("standard_monthly")).thenReturn(Optional.of(standardMonthly));
        when(stripeGateway.changePrice("sub_123", "price_premium_monthly")).thenReturn(
                new StripeSubscriptionSnapshot("sub_123", "cus_123", "active", null, null, false, null, null));
        saveSubscriptionsWithIds();
        when(taxService.calculate(new BigDecimal("6.99"), Province.ON))
                .thenReturn(ontarioTax("6.99", "0.91", "7.90"));

        // Act
        SubscriptionView view = subscriptionService.changePlan(user, "premium_monthly");

        // Assert
        assertEquals(SubscriptionTier.PREMIUM, view.getTier());
        assertEquals(new BigDecimal("6.99"), view.getAmount());

        ArgumentCaptor<BillingRecord> record = ArgumentCaptor.forClass(BillingRecord.class);
        verify(billingRecordRepository).save(record.capture());
        assertEquals(SubscriptionService.TYPE_UPGRADE, record.getValue().getTransactionType());
        assertEquals("Plan change: Standard Plan → Premium Plan", record.getValue().getDescription());
        verify(featureAccessRepository).deleteAllForUser(user.getId());
    }

    @Test
    @DisplayName("Changing to the current plan is refused")
    void testChangePlanSamePlan() {
        // Arrange
        when(subscriptionRepository.findByUserId(user.getId()))
                .thenReturn(Optional.of(activeSubscription(standardMonthly)));
        when(planRepository.findByIdAndIsActiveTrue("standard_monthly")).thenReturn(Optional.of(standardMonthly));

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> subscriptionService.changePlan(user, "standard_monthly"));
        assertEquals("New plan is the same as current plan", ex.getMessage());
        verifyNoInteractions(stripeGateway);
    }

    @Test
    @DisplayName("Cancelling in cooling-off with a refund refunds the last charge and ends immediately")
    void testCancelWithRefundInCoolingOff() {
        // Arrange
        Subscription subscription = activeSubscription(premiumYearly);
        subscription.setCoolingOffEnd(LocalDateTime.now(ZoneOffset.UTC).plusDays(10));
        BillingRecord charge = new BillingRecord();
        charge.setStripeChargeId("ch_1");
        charge.setTotalAmount(new BigDecimal("79.09"));

        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.of(subscription));
        when(billingRecordRepository
                .findFirstBySubscriptionIdAndStatusAndRefundedFalseAndStripeChargeIdIsNotNullOrderByCreatedAtDesc(
                        subscription.getId(), BillingRecord.STATUS_SUCCEEDED))
                .thenReturn(Optional.of(charge));
        when(stripeGateway.refundCharge("ch_1")).thenReturn("re_1");
        saveSubscriptionsWithIds();
        when(trialProgressRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(featureAccessRepository.findByUserIdOrderByFeatureIdAsc(user.getId())).thenReturn(List.of());

        // Act
        SubscriptionView view = subscriptionService.cancel(user, "Changed my mind", true);

        // Assert
        verify(stripeGateway).cancel("sub_123", true);
        assertEquals(SubscriptionStatus.CANCELED, view.getStatus());
        assertFalse(view.isCancelAtPeriodEnd());
        assertTrue(charge.getRefunded());
        assertEquals(new BigDecimal("79.09"), charge.getRefundAmount());

        ArgumentCaptor<BillingRecord> records = ArgumentCaptor.forClass(BillingRecord.class);
        verify(billingRecordRepository, times(2)).save(records.capture());
        BillingRecord cancellation = records.getAllValues().get(1);
        assertEquals(SubscriptionService.TYPE_REFUND, cancellation.getTransactionType());
        assertEquals("Subscription canceled: Changed my mind", cancellation.getDescription());
    }

    @Test
    @DisplayName("Cancelling outside cooling-off runs to the end of the period and revokes features")
    void testCancelAtPeriodEnd() {
        // Arrange
        Subscription subscription = activeSubscription(standardMonthly);
        FeatureAccess feature = new FeatureAccess();
        feature.setHasAccess(true);

        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.of(subscription));
        saveSubscriptionsWithIds();
        when(trialProgressRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(featureAccessRepository.findByUserIdOrderByFeatureIdAsc(user.getId())).thenReturn(List.of(feature));

        // Act
        SubscriptionView view = subscriptionService.cancel(user, null, true);

        // Assert
        verify(stripeGateway).cancel("sub_123", false);
        verify(stripeGateway, never()).refundCharge(any());
        assertTrue(view.isCancelAtPeriodEnd());
        assertFalse(feature.getHasAccess());
        assertNotNull(feature.getAccessExpiresAt());

        ArgumentCaptor<BillingRecord> record = ArgumentCaptor.forClass(BillingRecord.class);
        verify(billingRecordRepository).save(record.capture());
        assertEquals("Subscription canceled: No reason provided", record.getValue().getDescription());
        assertEquals(0, BigDecimal.ZERO.compareTo(record.getValue().getTotalAmount()));
    }

    @Test
    @DisplayName("Feature check without a record recommends an upgrade")
    void testCheckFeatureAccessWithoutRecord() {
        // Arrange
        when(featureAccessRepository.findByUserIdAndFeatureId(user.getId(), "price_alerts"))
                .thenReturn(Optional.empty());

        // Act
        FeatureAccessCheck check = subscriptionService.checkFeatureAccess(user, "price_alerts");

        // Assert
        assertFalse(check.isHasAccess());
        assertEquals(SubscriptionTier.STANDARD, check.getTierRequired());
        assertEquals("Upgrade to access Price Alerts", check.getUpgradeRecommendation());
    }

    @Test
    @DisplayName("Expired feature access names the required tier")
    void testCheckFeatureAccessExpired() {
        // Arrange
        FeatureAccess access = new FeatureAccess();
        access.setFeatureId("automation");
        access.setTierRequired(SubscriptionTier.PREMIUM);
        access.setHasAccess(true);
        access.setAccessSource(FeatureAccess.SOURCE_TRIAL);
        access.setAccessExpiresAt(LocalDateTime.now(ZoneOffset.UTC).minusDays(1));
        when(featureAccessRepository.findByUserIdAndFeatureId(user.getId(), "automation"))
                .thenReturn(Optional.of(access));

        // Act
        FeatureAccessCheck check = subscriptionService.checkFeatureAccess(user, "automation");

        // Assert
        assertFalse(check.isHasAccess());
        assertEquals("Upgrade to Premium plan to access this feature", check.getUpgradeRecommendation());
    }

    @Test
    @DisplayName("Billing province change records a zero-amount entry; same province is refused")
    void testUpdateBillingProvince() {
        // Arrange
        Subscription subscription = activeSubscription(standardMonthly);
        when(subscriptionRepository.findByUserId(user.getId())).thenReturn(Optional.of(subscription));
        saveSubscriptionsWithIds();

        // Act
        SubscriptionView view = subscriptionService.updateBillingProvince(user, Province.QC);

        // Assert
        assertEquals(Province.QC, view.getProvince());
        ArgumentCaptor<BillingRecord> record = ArgumentCaptor.forClass(BillingRecord.class);
        verify(billingRecordRepository).save(record.capture());
        assertEquals("Billing province changed: ON → QC", record.getValue().getDescription());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> subscriptionService.updateBillingProvince(user, Province.QC));
        assertEquals("Province is already set to QC", ex.getMessage());
    }

    @Test
    @DisplayName("Tier decides upgrade, price breaks ties")
    void testIsUpgrade() {
        assertTrue(SubscriptionService.isUpgrade(standardMonthly, premiumMonthly));
        assertFalse(SubscriptionService.isUpgrade(premiumYearly, standardMonthly));
        assertTrue(SubscriptionService.isUpgrade(premiumMonthly, premiumYearly));
    }
}
