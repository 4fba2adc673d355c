package ca.nestsync.repository;

import ca.nestsync.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for Subscription entity operations.
 *
 * Stripe webhooks resolve the local row through the Stripe subscription id;
 * GraphQL resolvers go through the user id.
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByUserId(UUID userId);

    Optional<Subscription> findByStripeSubscriptionId(String stripeSubscriptionId);

    Optional<Subscription> findFirstByStripeCustomerId(String stripeCustomerId);
}
