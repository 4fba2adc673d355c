package ca.nestsync.dto.response;

import ca.nestsync.entity.SubscriptionPlan;
import ca.nestsync.entity.TrialProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrialProgressView {

    private UUID id;
    private Boolean isActive;
    private SubscriptionPlan.SubscriptionTier trialTier;
    private LocalDateTime trialStartedAt;
    private LocalDateTime trialEndsAt;
    private int daysRemaining;
    private boolean convertedToPaid;
    private LocalDateTime convertedAt;
    private boolean canceled;
    private int featuresUsedCount;
    private BigDecimal valueSavedEstimate;

    public static TrialProgressView from(TrialProgress trial, LocalDateTime now) {
        return TrialProgressView.builder()
                .id(trial.getId())
                .isActive(Boolean.TRUE.equals(trial.getIsActive()))
                .trialTier(trial.getTrialTier())
                .trialStartedAt(trial.getTrialStartedAt())
                .trialEndsAt(trial.getTrialEndsAt())
                .daysRemaining(trial.daysRemaining(now))
                .convertedToPaid(Boolean.TRUE.equals(trial.getConvertedToPaid()))
                .convertedAt(trial.getConvertedAt())
                .canceled(Boolean.TRUE.equals(trial.getCanceled()))
                .featuresUsedCount(trial.getFeaturesUsedCount())
                .valueSavedEstimate(trial.getValueSavedEstimate())
                .build();
    }
}
