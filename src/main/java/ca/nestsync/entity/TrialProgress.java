package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Tracks a user's single free trial and its engagement.
 *
 * Database Table: trial_progress
 */
@Entity
@Table(name = "trial_progress", indexes = {
    @Index(name = "idx_trial_user_id", columnList = "user_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrialProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "trial_tier", nullable = false, length = 20)
    private SubscriptionPlan.SubscriptionTier trialTier;

    @Column(name = "trial_started_at", nullable = false)
    private LocalDateTime trialStartedAt;

    @Column(name = "trial_ends_at", nullable = false)
    private LocalDateTime trialEndsAt;

    @Column(name = "converted_to_paid", nullable = false)
    private Boolean convertedToPaid = false;

    @Column(name = "converted_at")
    private LocalDateTime convertedAt;

    @Column(name = "conversion_plan_id", length = 50)
    private String conversionPlanId;

    @Column(name = "canceled", nullable = false)
    private Boolean canceled = false;

    @Column(name = "canceled_at")
    private LocalDateTime canceledAt;

    @Column(name = "features_used_count", nullable = false)
    private Integer featuresUsedCount = 0;

    @Column(name = "value_saved_estimate", nullable = false, precision = 10, scale = 2)
    private BigDecimal valueSavedEstimate = BigDecimal.ZERO;

    @Column(name = "last_activity_at")
    private LocalDateTime lastActivityAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Whole days left in the trial, rounded up; 0 once ended or inactive.
     */
    public int daysRemaining(LocalDateTime now) {
        if (!Boolean.TRUE.equals(isActive) || !trialEndsAt.isAfter(now)) {
            return 0;
        }
        long seconds = Duration.between(now, trialEndsAt).getSeconds();
        return (int) ((seconds + 86_399) / 86_400);
    }

    public void markConverted(String planId, LocalDateTime now) {
        this.convertedToPaid = true;
        this.convertedAt = now;
        this.conversionPlanId = planId;
        this.isActive = false;
    }

    public void markCanceled(LocalDateTime now) {
        this.canceled = true;
        this.canceledAt = now;
        this.isActive = false;
    }
}
