package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Effective-dated provincial sales tax rate.
 *
 * Database Table: canadian_tax_rates
 */
@Entity
@Table(name = "canadian_tax_rates", indexes = {
    @Index(name = "idx_tax_rate_province_effective", columnList = "province, effective_from")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanadianTaxRate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "province", nullable = false, length = 2)
    private Province province;

    @Column(name = "province_name", nullable = false, length = 100)
    private String provinceName;

    @Builder.Default
    @Column(name = "gst_rate", nullable = false, precision = 6, scale = 5)
    private BigDecimal gstRate = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "pst_rate", nullable = false, precision = 6, scale = 5)
    private BigDecimal pstRate = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "hst_rate", nullable = false, precision = 6, scale = 5)
    private BigDecimal hstRate = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "qst_rate", nullable = false, precision = 6, scale = 5)
    private BigDecimal qstRate = BigDecimal.ZERO;

    @Column(name = "combined_rate", nullable = false, precision = 6, scale = 5)
    private BigDecimal combinedRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "tax_type", nullable = false, length = 10)
    private TaxType taxType;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    @Column(name = "effective_to")
    private LocalDate effectiveTo;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public enum Province {
        ON("Ontario"),
        QC("Quebec"),
        BC("British Columbia"),
        AB("Alberta"),
        SK("Saskatchewan"),
        MB("Manitoba"),
        NS("Nova Scotia"),
        NB("New Brunswick"),
        PE("Prince Edward Island"),
        NL("Newfoundland and Labrador"),
        NT("Northwest Territories"),
        YT("Yukon"),
        NU("Nunavut");

        private final String displayName;

        Province(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public enum TaxType {
        GST_PST,
        HST,
        GST_QST,
        GST;

        /**
         * Parse the combined label used on receipts, e.g. "GST+PST".
         */
        public static TaxType fromLabel(String label) {
            return TaxType.valueOf(label.trim().toUpperCase().replace("+", "_"));
        }

        public String label() {
            return name().replace("_", "+");
        }
    }
}
