package ca.nestsync.graphql;

import ca.nestsync.dto.request.SubscribeInput;
import ca.nestsync.dto.response.FeatureAccessCheck;
import ca.nestsync.dto.response.SubscriptionResponse;
import ca.nestsync.dto.response.SubscriptionView;
import ca.nestsync.dto.response.TrialProgressView;
import ca.nestsync.entity.BillingRecord;
import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.CanadianTaxRate.Province;
import ca.nestsync.entity.FeatureAccess;
import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.SubscriptionPlan.SubscriptionTier;
import ca.nestsync.entity.TaxBreakdown;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.CanadianTaxService;
import ca.nestsync.service.SubscriptionService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.math.BigDecimal;
import java.util.List;

/**
 * Plans, trials, paid subscriptions, billing history and Canadian tax.
 *
 * Plan and tax queries are public; everything else needs a signed-in user.
 */
@Controller
@RequiredArgsConstructor
public class SubscriptionGraphQlController {

    private final SubscriptionService subscriptionService;
    private final CanadianTaxService taxService;
    private final UserService userService;

    @QueryMapping
    public List<SubscriptionPlan> availablePlans() {
        return subscriptionService.getAvailablePlans();
    }

    @QueryMapping
    public SubscriptionPlan subscriptionPlan(@Argument String id) {
        return subscriptionService.getPlan(id);
    }

    @QueryMapping
    public SubscriptionView mySubscription() {
        return subscriptionService.getMySubscription(userService.requireCurrentUser());
    }

    @QueryMapping
    public TrialProgressView myTrialProgress() {
        return subscriptionService.getMyTrialProgress(userService.requireCurrentUser());
    }

    @QueryMapping
    public List<BillingRecord> myBillingHistory(@Argument Integer limit, @Argument Integer offset) {
        return subscriptionService.getBillingHistory(userService.requireCurrentUser(),
                limit != null ? limit : 20, offset != null ? offset : 0);
    }

    @QueryMapping
    public FeatureAccessCheck checkFeatureAccess(@Argument String featureId) {
        return subscriptionService.checkFeatureAccess(userService.requireCurrentUser(), featureId);
    }

    @QueryMapping
    public List<FeatureAccess> myFeatureAccess() {
        return subscriptionService.getMyFeatureAccess(userService.requireCurrentUser());
    }

    @QueryMapping
    public List<CanadianTaxRate> taxRates() {
        return taxService.getTaxRates();
    }

    @QueryMapping
    public TaxBreakdown calculateTax(@Argument Double amount, @Argument Province province) {
        return taxService.calculate(BigDecimal.valueOf(amount), province);
    }

    @MutationMapping
    public SubscriptionResponse startTrial(@Argument SubscriptionTier tier, @Argument Province province) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> SubscriptionResponse.ok(subscriptionService.startTrial(user, tier, province),
                        "Trial started successfully"),
                SubscriptionResponse::failure);
    }

    @MutationMapping
    public SubscriptionResponse subscribe(@Argument @Valid SubscribeInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> SubscriptionResponse.ok(subscriptionService.subscribe(user, input), "Subscription created successfully"),
                SubscriptionResponse::failure);
    }

    @MutationMapping
    public SubscriptionResponse changeSubscriptionPlan(@Argument String newPlanId) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> SubscriptionResponse.ok(subscriptionService.changePlan(user, newPlanId),
                        "Subscription updated successfully"),
                SubscriptionResponse::failure);
    }

    @MutationMapping
    public SubscriptionResponse cancelSubscription(@Argument String reason, @Argument Boolean requestRefund) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            SubscriptionView view = subscriptionService.cancel(user, reason, Boolean.TRUE.equals(requestRefund));
            String message = view.isCancelAtPeriodEnd()
                    ? "Subscription will be cancelled at the end of the current period"
                    : "Subscription cancelled";
            return SubscriptionResponse.ok(view, message);
        }, SubscriptionResponse::failure);
    }

    @MutationMapping
    public SubscriptionResponse updateBillingProvince(@Argument Province province) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> SubscriptionResponse.ok(subscriptionService.updateBillingProvince(user, province),
                        "Billing province updated"),
                SubscriptionResponse::failure);
    }
}
