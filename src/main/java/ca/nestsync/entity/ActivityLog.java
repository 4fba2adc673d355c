package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log of collaboration actions inside a family.
 *
 * Database Table: collaboration_logs
 */
@Entity
@Table(name = "collaboration_logs", indexes = {
    @Index(name = "idx_collab_log_family_created", columnList = "family_id, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "family_id", nullable = false)
    private UUID familyId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "child_id")
    private UUID childId;

    /**
     * e.g. family_created, member_invited, member_joined, member_removed, child_shared.
     */
    @Column(name = "action_type", nullable = false, length = 50)
    private String actionType;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ActivityLog(UUID familyId, UUID userId, UUID childId, String actionType, String description) {
        this.familyId = familyId;
        this.userId = userId;
        this.childId = childId;
        this.actionType = actionType;
        this.description = description;
    }
}
