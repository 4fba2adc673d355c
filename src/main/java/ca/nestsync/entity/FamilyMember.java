package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Membership of a user in a family, with a role and a permission map.
 *
 * Database Table: family_members
 */
@Entity
@Table(name = "family_members",
    uniqueConstraints = @UniqueConstraint(name = "uk_family_member", columnNames = {"family_id", "user_id"}),
    indexes = {
        @Index(name = "idx_family_member_user_id", columnList = "user_id"),
        @Index(name = "idx_family_member_family_id", columnList = "family_id")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "family_id", nullable = false)
    private UUID familyId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 30)
    private MemberRole role;

    /**
     * Permission keys (can_invite_members, edit_child_profiles, ...) to boolean,
     * list or string values. Interpreted by FamilyPermissionService.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "permissions", columnDefinition = "jsonb")
    private Map<String, Object> permissions = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MemberStatus status = MemberStatus.ACTIVE;

    @Column(name = "invited_by")
    private UUID invitedBy;

    @Column(name = "joined_at")
    private LocalDateTime joinedAt;

    @Column(name = "access_expires_at")
    private LocalDateTime accessExpiresAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "access_restrictions", columnDefinition = "jsonb")
    private Map<String, Object> accessRestrictions = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isAccessExpired(LocalDateTime now) {
        return accessExpiresAt != null && accessExpiresAt.isBefore(now);
    }

    public enum MemberRole {
        FAMILY_CORE,
        EXTENDED_FAMILY,
        PROFESSIONAL,
        INSTITUTIONAL
    }

    public enum MemberStatus {
        ACTIVE,
        INACTIVE,
        PENDING,
        SUSPENDED
    }
}
