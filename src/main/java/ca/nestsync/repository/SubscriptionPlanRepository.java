package ca.nestsync.repository;

import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.SubscriptionPlan.BillingInterval;
import ca.nestsync.entity.SubscriptionPlan.SubscriptionTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, String> {

    List<SubscriptionPlan> findByIsActiveTrueOrderBySortOrderAsc();

    Optional<SubscriptionPlan> findByIdAndIsActiveTrue(String id);

    Optional<SubscriptionPlan> findFirstByTierAndBillingIntervalAndIsActiveTrue(
            SubscriptionTier tier, BillingInterval billingInterval);
}
