package ca.nestsync.repository;

import ca.nestsync.entity.BillingRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillingRecordRepository extends JpaRepository<BillingRecord, UUID> {

    List<BillingRecord> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    /**
     * Latest refundable charge of a subscription.
     */
    Optional<BillingRecord> findFirstBySubscriptionIdAndStatusAndRefundedFalseAndStripeChargeIdIsNotNullOrderByCreatedAtDesc(
            UUID subscriptionId, String status);

    boolean existsByStripeInvoiceId(String stripeInvoiceId);
}
