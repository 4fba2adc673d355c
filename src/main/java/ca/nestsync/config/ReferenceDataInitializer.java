package ca.nestsync.config;

import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.CanadianTaxRate.Province;
import ca.nestsync.entity.CanadianTaxRate.TaxType;
import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.SubscriptionPlan.BillingInterval;
import ca.nestsync.entity.SubscriptionPlan.SubscriptionTier;
import ca.nestsync.repository.CanadianTaxRateRepository;
import ca.nestsync.repository.SubscriptionPlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds subscription plans and Canadian tax rates on startup.
 *
 * Existing plans keep their row; only a missing Stripe price id is filled in
 * from configuration. Tax rates are inserted once per province and effective date.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.seed-reference-data", havingValue = "true", matchIfMissing = true)
public class ReferenceDataInitializer implements ApplicationRunner {

    private static final List<String> STANDARD_FEATURES =
            List.of("family_sharing", "reorder_suggestions", "basic_analytics");
    private static final List<String> PREMIUM_FEATURES =
            List.of("family_sharing", "unlimited_reorder_suggestions", "advanced_analytics", "price_alerts", "automation");

    private final SubscriptionPlanRepository planRepository;
    private final CanadianTaxRateRepository taxRateRepository;

    @Value("${app.stripe.prices.standard-monthly:}")
    private String standardMonthlyPriceId;

    @Value("${app.stripe.prices.standard-yearly:}")
    private String standardYearlyPriceId;

    @Value("${app.stripe.prices.premium-monthly:}")
    private String premiumMonthlyPriceId;

    @Value("${app.stripe.prices.premium-yearly:}")
    private String premiumYearlyPriceId;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int plans = seedPlans();
        int rates = seedTaxRates();
        log.info("Reference data ready: {} plans added or updated, {} tax rates added", plans, rates);
    }

    int seedPlans() {
        int changed = 0;
        for (SubscriptionPlan plan : defaultPlans()) {
            SubscriptionPlan existing = planRepository.findById(plan.getId()).orElse(null);
            if (existing == null) {
                planRepository.save(plan);
                changed++;
            } else if (existing.getStripePriceId() == null && plan.getStripePriceId() != null) {
                existing.setStripePriceId(plan.getStripePriceId());
                planRepository.save(existing);
                changed++;
            }
        }
        return changed;
    }

    int seedTaxRates() {
        int added = 0;
        for (CanadianTaxRate rate : defaultTaxRates()) {
            if (!taxRateRepository.existsByProvinceAndEffectiveFrom(rate.getProvince(), rate.getEffectiveFrom())) {
                taxRateRepository.save(rate);
                added++;
            }
        }
        return added;
    }

    List<SubscriptionPlan> defaultPlans() {
        List<SubscriptionPlan> plans = new ArrayList<>();
        plans.add(plan("free", "Free", "Free Plan", SubscriptionTier.FREE, "0.00", BillingInterval.MONTHLY,
                List.of(), limits(1, 0, false, false), 0, null,
                "Track inventory and diaper changes for your family"));
        plans.add(plan("standard_monthly", "Standard", "Standard Plan", SubscriptionTier.STANDARD, "4.99",
                BillingInterval.MONTHLY, STANDARD_FEATURES, limits(10, 5, false, false), 1,
                standardMonthlyPriceId, "Family sharing, reorder suggestions and basic analytics"));
        plans.add(plan("standard_yearly", "Standard", "Standard Plan (Annual)", SubscriptionTier.STANDARD, "49.99",
                BillingInterval.YEARLY, STANDARD_FEATURES, limits(10, 5, false, false), 2,
                standardYearlyPriceId, "Standard features billed yearly"));
        plans.add(plan("premium_monthly", "Premium", "Premium Plan", SubscriptionTier.PREMIUM, "6.99",
                BillingInterval.MONTHLY, PREMIUM_FEATURES, limits(-1, -1, true, true), 3,
                premiumMonthlyPriceId, "Unlimited suggestions, advanced analytics, price alerts and automation"));
        plans.add(plan("premium_yearly", "Premium", "Premium Plan (Annual)", SubscriptionTier.PREMIUM, "69.99",
                BillingInterval.YEARLY, PREMIUM_FEATURES, limits(-1, -1, true, true), 4,
                premiumYearlyPriceId, "Premium features billed yearly"));
        return plans;
    }

    public static List<CanadianTaxRate> defaultTaxRates() {
        return List.of(
                hst(Province.ON, "0.13", LocalDate.of(2010, 7, 1)),
                rate(Province.QC, TaxType.GST_QST, "0.05", "0", "0.09975", "0.14975", LocalDate.of(2013, 1, 1)),
                rate(Province.BC, TaxType.GST_PST, "0.05", "0.07", "0", "0.12", LocalDate.of(2013, 4, 1)),
                gst(Province.AB, LocalDate.of(1991, 1, 1)),
                rate(Province.SK, TaxType.GST_PST, "0.05", "0.06", "0", "0.11", LocalDate.of(2017, 3, 23)),
                rate(Province.MB, TaxType.GST_PST, "0.05", "0.07", "0", "0.12", LocalDate.of(2013, 7, 1)),
                hst(Province.NS, "0.15", LocalDate.of(2010, 7, 1)),
                hst(Province.NB, "0.15", LocalDate.of(2016, 7, 1)),
                hst(Province.PE, "0.15", LocalDate.of(2016, 10, 1)),
                hst(Province.NL, "0.15", LocalDate.of(2016, 7, 1)),
                gst(Province.NT, LocalDate.of(1991, 1, 1)),
                gst(Province.YT, LocalDate.of(1991, 1, 1)),
                gst(Province.NU, LocalDate.of(1999, 4, 1))
        );
    }

    private static SubscriptionPlan plan(String id, String name, String displayName, SubscriptionTier tier,
                                         String price, BillingInterval interval, List<String> features,
                                         Map<String, Object> limits, int sortOrder, String stripePriceId,
                                         String description) {
        return SubscriptionPlan.builder()
                .id(id)
                .name(name)
                .displayName(displayName)
                .tier(tier)
                .price(new BigDecimal(price))
                .billingInterval(interval)
                .features(new ArrayList<>(features))
                .limits(limits)
                .sortOrder(sortOrder)
                .isActive(true)
                .stripePriceId(stripePriceId == null || stripePriceId.isBlank() ? null : stripePriceId)
                .description(description)
                .build();
    }

    private static Map<String, Object> limits(int familyMembers, int reorderSuggestions,
                                              boolean priceAlerts, boolean automation) {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("familyMembers", familyMembers);
        limits.put("reorderSuggestions", reorderSuggestions);
        limits.put("priceAlerts", priceAlerts);
        limits.put("automation", automation);
        return limits;
    }

    private static CanadianTaxRate hst(Province province, String rate, LocalDate from) {
        return CanadianTaxRate.builder()
                .province(province)
                .provinceName(province.getDisplayName())
                .hstRate(new BigDecimal(rate))
                .combinedRate(new BigDecimal(rate))
                .taxType(TaxType.HST)
                .effectiveFrom(from)
                .build();
    }

    private static CanadianTaxRate gst(Province province, LocalDate from) {
        return rate(province, TaxType.GST, "0.05", "0", "0", "0.05", from);
    }

    private static CanadianTaxRate rate(Province province, TaxType type, String gst, String pst, String qst,
                                        String combined, LocalDate from) {
        return CanadianTaxRate.builder()
                .province(province)
                .provinceName(province.getDisplayName())
                .gstRate(new BigDecimal(gst))
                .pstRate(new BigDecimal(pst))
                .qstRate(new BigDecimal(qst))
                .combinedRate(new BigDecimal(combined))
                .taxType(type)
                .effectiveFrom(from)
                .build();
    }
}
