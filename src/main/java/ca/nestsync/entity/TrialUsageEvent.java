package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Database Table: trial_usage_events
 */
@Entity
@Table(name = "trial_usage_events", indexes = {
    @Index(name = "idx_trial_event_trial_id", columnList = "trial_progress_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrialUsageEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trial_progress_id", nullable = false)
    private UUID trialProgressId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "feature_used", length = 100)
    private String featureUsed;

    @Column(name = "event_description", columnDefinition = "TEXT")
    private String eventDescription;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public TrialUsageEvent(UUID trialProgressId, UUID userId, String eventType, String description) {
        this.trialProgressId = trialProgressId;
        this.userId = userId;
        this.eventType = eventType;
        this.eventDescription = description;
    }
}
