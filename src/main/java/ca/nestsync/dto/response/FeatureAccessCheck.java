package ca.nestsync.dto.response;

import ca.nestsync.entity.SubscriptionPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Answer to "may this user use feature X", with an upgrade hint when not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureAccessCheck {

    private String featureId;
    private boolean hasAccess;
    private SubscriptionPlan.SubscriptionTier tierRequired;
    private String accessSource;
    private LocalDateTime accessExpiresAt;
    private String upgradeRecommendation;
}
