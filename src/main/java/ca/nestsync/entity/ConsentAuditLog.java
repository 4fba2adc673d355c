package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only audit trail of consent changes.
 *
 * Database Table: consent_audit_logs
 */
@Entity
@Table(name = "consent_audit_logs", indexes = {
    @Index(name = "idx_consent_audit_user_id", columnList = "user_id"),
    @Index(name = "idx_consent_audit_consent_id", columnList = "consent_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsentAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "consent_id", nullable = false)
    private UUID consentId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * grant, withdraw or expire.
     */
    @Column(name = "action", nullable = false, length = 20)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 20)
    private ConsentRecord.ConsentStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 20)
    private ConsentRecord.ConsentStatus newStatus;

    @Column(name = "consent_version", length = 10)
    private String consentVersion;

    @Column(name = "reason", length = 500)
    private String reason;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ConsentAuditLog(ConsentRecord consent, String action,
                           ConsentRecord.ConsentStatus previousStatus, String reason) {
        this.consentId = consent.getId();
        this.userId = consent.getUserId();
        this.action = action;
        this.previousStatus = previousStatus;
        this.newStatus = consent.getStatus();
        this.consentVersion = consent.getConsentVersion();
        this.reason = reason;
    }
}
