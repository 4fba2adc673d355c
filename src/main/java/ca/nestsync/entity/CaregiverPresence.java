package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Last reported presence of a caregiver within a family.
 *
 * Database Table: caregiver_presence
 */
@Entity
@Table(name = "caregiver_presence",
    uniqueConstraints = @UniqueConstraint(name = "uk_presence_family_user", columnNames = {"family_id", "user_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaregiverPresence {

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

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PresenceStatus status = PresenceStatus.OFFLINE;

    @Column(name = "current_activity", length = 200)
    private String currentActivity;

    @Column(name = "last_seen_at", nullable = false)
    private LocalDateTime lastSeenAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public enum PresenceStatus {
        ONLINE,
        CARING,
        AWAY,
        OFFLINE
    }
}
