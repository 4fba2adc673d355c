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
 * PIPEDA consent record: one row per user and consent type.
 *
 * Status transitions: PENDING → GRANTED → WITHDRAWN, and GRANTED → EXPIRED
 * once {@code expiresAt} passes. A withdrawn consent can be granted again.
 *
 * Database Table: consent_records
 */
@Entity
@Table(name = "consent_records",
    uniqueConstraints = @UniqueConstraint(name = "uq_consent_user_type", columnNames = {"user_id", "consent_type"}),
    indexes = {
        @Index(name = "idx_consent_user_id", columnList = "user_id"),
        @Index(name = "idx_consent_status", columnList = "status")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "consent_type", nullable = false, length = 30)
    private ConsentType consentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConsentStatus status = ConsentStatus.PENDING;

    @Column(name = "purpose", columnDefinition = "TEXT")
    private String purpose;

    @Column(name = "consent_version", nullable = false, length = 10)
    private String consentVersion;

    @Column(name = "granted_at")
    private LocalDateTime grantedAt;

    @Column(name = "withdrawn_at")
    private LocalDateTime withdrawnAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "withdrawal_reason", length = 500)
    private String withdrawalReason;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public ConsentRecord(UUID userId, ConsentType consentType, String purpose, String consentVersion) {
        this.userId = userId;
        this.consentType = consentType;
        this.purpose = purpose;
        this.consentVersion = consentVersion;
        this.status = ConsentStatus.PENDING;
    }

    public void grant(String version, LocalDateTime now, LocalDateTime expiresAt) {
        this.status = ConsentStatus.GRANTED;
        this.consentVersion = version;
        this.grantedAt = now;
        this.expiresAt = expiresAt;
        this.withdrawnAt = null;
        this.withdrawalReason = null;
    }

    public void withdraw(String reason, LocalDateTime now) {
        this.status = ConsentStatus.WITHDRAWN;
        this.withdrawnAt = now;
        this.withdrawalReason = reason;
    }

    /**
     * Granted and not past its expiry.
     */
    public boolean isActive(LocalDateTime now) {
        return status == ConsentStatus.GRANTED && (expiresAt == null || expiresAt.isAfter(now));
    }

    public enum ConsentType {
        PRIVACY_POLICY("Process personal data according to privacy policy", true),
        TERMS_OF_SERVICE("Use the NestSync application services", true),
        MARKETING("Send marketing communications and product updates", false),
        ANALYTICS("Analyze usage patterns to improve the application", false),
        DATA_SHARING("Share anonymized data with research partners", false),
        COOKIES("Use cookies and similar technologies for functionality", false),
        LOCATION_TRACKING("Track location for emergency store finder features", false),
        BIOMETRIC_DATA("Use biometric authentication for enhanced security", false),
        CHILD_DATA("Store and process information about your children", false),
        EMERGENCY_CONTACTS("Share information with designated emergency contacts", false);

        private final String purpose;
        private final boolean required;

        ConsentType(String purpose, boolean required) {
            this.purpose = purpose;
            this.required = required;
        }

        public String getPurpose() {
            return purpose;
        }

        public boolean isRequired() {
            return required;
        }
    }

    public enum ConsentStatus {
        GRANTED,
        WITHDRAWN,
        EXPIRED,
        PENDING
    }
}
