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
 * Email invitation to join a family. Redeemed by its random token within 7 days.
 *
 * Database Table: caregiver_invitations
 */
@Entity
@Table(name = "caregiver_invitations", indexes = {
    @Index(name = "idx_invitation_token", columnList = "invitation_token", unique = true),
    @Index(name = "idx_invitation_family_email", columnList = "family_id, email")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaregiverInvitation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "family_id", nullable = false)
    private UUID familyId;

    @Column(name = "invited_by", nullable = false)
    private UUID invitedBy;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 30)
    private FamilyMember.MemberRole role;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "invitation_token", nullable = false, unique = true, length = 100)
    private String invitationToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private InvitationStatus status = InvitationStatus.PENDING;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Column(name = "accepted_by")
    private UUID acceptedBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isRedeemable(LocalDateTime now) {
        return status == InvitationStatus.PENDING && expiresAt.isAfter(now);
    }

    public enum InvitationStatus {
        PENDING,
        ACCEPTED,
        EXPIRED,
        DECLINED,
        CANCELLED
    }
}
