package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Billing history entry: charges, plan changes, refunds and cancellations,
 * with the Canadian tax breakdown.
 *
 * Database Table: billing_history
 */
@Entity
@Table(name = "billing_history", indexes = {
    @Index(name = "idx_billing_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_billing_subscription_id", columnList = "subscription_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BillingRecord {

    public static final String STATUS_SUCCEEDED = "succeeded";
    public static final String STATUS_REFUNDED = "refunded";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    /**
     * subscription_charge, trial_conversion, upgrade, downgrade or refund.
     */
    @Column(name = "transaction_type", nullable = false, length = 30)
    private String transactionType;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "subtotal", nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(name = "tax_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "CAD";

    @Enumerated(EnumType.STRING)
    @Column(name = "province", length = 2)
    private CanadianTaxRate.Province province;

    @Column(name = "gst_amount", precision = 10, scale = 2)
    private BigDecimal gstAmount;

    @Column(name = "pst_amount", precision = 10, scale = 2)
    private BigDecimal pstAmount;

    @Column(name = "hst_amount", precision = 10, scale = 2)
    private BigDecimal hstAmount;

    @Column(name = "qst_amount", precision = 10, scale = 2)
    private BigDecimal qstAmount;

    @Column(name = "tax_rate", precision = 6, scale = 5)
    private BigDecimal taxRate;

    @Column(name = "status", nullable = false, length = 20)
    private String status = STATUS_SUCCEEDED;

    @Column(name = "stripe_invoice_id", length = 100)
    private String stripeInvoiceId;

    @Column(name = "stripe_charge_id", length = 100)
    private String stripeChargeId;

    @Column(name = "stripe_payment_intent_id", length = 100)
    private String stripePaymentIntentId;

    @Column(name = "period_start")
    private LocalDateTime periodStart;

    @Column(name = "period_end")
    private LocalDateTime periodEnd;

    @Column(name = "refunded", nullable = false)
    private Boolean refunded = false;

    @Column(name = "refund_amount", precision = 10, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "refund_reason", columnDefinition = "TEXT")
    private String refundReason;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "invoice_pdf_url", columnDefinition = "TEXT")
    private String invoicePdfUrl;

    @Column(name = "receipt_url", columnDefinition = "TEXT")
    private String receiptUrl;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void applyTax(TaxBreakdown tax) {
        this.subtotal = tax.subtotal();
        this.taxAmount = tax.totalTax();
        this.totalAmount = tax.totalAmount();
        this.province = tax.province();
        this.gstAmount = tax.gstAmount();
        this.pstAmount = tax.pstAmount();
        this.hstAmount = tax.hstAmount();
        this.qstAmount = tax.qstAmount();
        this.taxRate = tax.combinedRate();
    }

    public void markRefunded(String reason, LocalDateTime now) {
        this.refunded = true;
        this.refundAmount = totalAmount;
        this.refundReason = reason;
        this.refundedAt = now;
        this.status = STATUS_REFUNDED;
    }
}
