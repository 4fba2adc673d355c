package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-user grant of a premium feature, sourced from a trial or a paid subscription.
 *
 * Database Table: feature_access
 */
@Entity
@Table(name = "feature_access",
    uniqueConstraints = @UniqueConstraint(name = "uk_feature_access_user_feature", columnNames = {"user_id", "feature_id"}),
    indexes = @Index(name = "idx_feature_access_user_id", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeatureAccess {

    public static final String SOURCE_TRIAL = "trial";
    public static final String SOURCE_SUBSCRIPTION = "subscription";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "feature_id", nullable = false, length = 100)
    private String featureId;

    @Column(name = "feature_name", nullable = false, length = 200)
    private String featureName;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier_required", nullable = false, length = 20)
    private SubscriptionPlan.SubscriptionTier tierRequired;

    @Column(name = "has_access", nullable = false)
    private Boolean hasAccess = true;

    @Column(name = "access_source", nullable = false, length = 20)
    private String accessSource;

    @Column(name = "usage_limit")
    private Integer usageLimit;

    @Column(name = "usage_count", nullable = false)
    private Integer usageCount = 0;

    @Column(name = "access_granted_at", nullable = false)
    private LocalDateTime accessGrantedAt;

    @Column(name = "access_expires_at")
    private LocalDateTime accessExpiresAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isUsable(LocalDateTime now) {
        return Boolean.TRUE.equals(hasAccess) && (accessExpiresAt == null || accessExpiresAt.isAfter(now));
    }

    /**
     * "family_sharing" → "Family Sharing".
     */
    public static String displayName(String featureId) {
        StringBuilder sb = new StringBuilder();
        for (String word : featureId.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
