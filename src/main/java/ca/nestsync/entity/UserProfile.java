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
 * Local profile of a NestSync parent or caregiver.
 *
 * Credentials live in Supabase Auth; this row holds the Canadian-specific
 * profile (province, timezone, language), onboarding state and the quick-access
 * consent flags mirrored from {@link ConsentRecord}.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_email", columnList = "email", unique = true),
    @Index(name = "idx_user_supabase_id", columnList = "supabase_user_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Subject of the Supabase access token.
     */
    @Column(name = "supabase_user_id", nullable = false, unique = true, updatable = false)
    private UUID supabaseUserId;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "timezone", nullable = false, length = 50)
    private String timezone = "America/Toronto";

    @Column(name = "language", nullable = false, length = 10)
    private String language = "en";

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "CAD";

    /**
     * Two-letter province or territory code.
     */
    @Column(name = "province", length = 2)
    private String province;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private UserStatus status = UserStatus.PENDING_VERIFICATION;

    @Column(name = "email_verified", nullable = false)
    private Boolean emailVerified = false;

    @Column(name = "onboarding_completed", nullable = false)
    private Boolean onboardingCompleted = false;

    @Column(name = "onboarding_completed_at")
    private LocalDateTime onboardingCompletedAt;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "privacy_policy_accepted", nullable = false)
    private Boolean privacyPolicyAccepted = false;

    @Column(name = "terms_of_service_accepted", nullable = false)
    private Boolean termsOfServiceAccepted = false;

    @Column(name = "marketing_consent", nullable = false)
    private Boolean marketingConsent = false;

    @Column(name = "analytics_consent", nullable = false)
    private Boolean analyticsConsent = false;

    @Column(name = "consent_version", length = 10)
    private String consentVersion;

    @Column(name = "deletion_requested_at")
    private LocalDateTime deletionRequestedAt;

    @Column(name = "is_deleted", nullable = false)
    private Boolean isDeleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public UserProfile(UUID supabaseUserId, String email) {
        this.supabaseUserId = supabaseUserId;
        this.email = email;
    }

    /**
     * Display name if set, otherwise "first last", otherwise the email.
     */
    public String resolveDisplayName() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        String full = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        return full.isEmpty() ? email : full;
    }

    public enum UserStatus {
        ACTIVE,
        INACTIVE,
        SUSPENDED,
        PENDING_VERIFICATION,
        PENDING_DELETION
    }
}
