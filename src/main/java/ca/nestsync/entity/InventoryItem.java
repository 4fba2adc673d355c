package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A purchased pack of diapers, wipes or cream for one child.
 *
 * {@code quantityRemaining} is decremented by logged usage and always stays
 * within 0..quantityTotal.
 *
 * Database Table: inventory_items
 */
@Entity
@Table(name = "inventory_items", indexes = {
    @Index(name = "idx_inventory_child_id", columnList = "child_id"),
    @Index(name = "idx_inventory_product_type", columnList = "product_type"),
    @Index(name = "idx_inventory_expiry_date", columnList = "expiry_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItem {

    public static final String TYPE_DIAPER = "diaper";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "child_id", nullable = false)
    private UUID childId;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    /**
     * diaper, wipes, cream or other.
     */
    @Column(name = "product_type", nullable = false, length = 20)
    private String productType;

    @Column(name = "brand", nullable = false, length = 100)
    private String brand;

    @Column(name = "product_name", length = 200)
    private String productName;

    /**
     * Diaper size name (e.g. SIZE_2) for diapers, free text otherwise.
     */
    @Column(name = "size", nullable = false, length = 20)
    private String size;

    @Column(name = "quantity_total", nullable = false)
    private Integer quantityTotal;

    @Column(name = "quantity_remaining", nullable = false)
    private Integer quantityRemaining;

    @Column(name = "cost_cad", precision = 10, scale = 2)
    private BigDecimal costCad;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(name = "storage_location", length = 100)
    private String storageLocation;

    @Column(name = "is_opened", nullable = false)
    private Boolean isOpened = false;

    @Column(name = "opened_date")
    private LocalDate openedDate;

    @Column(name = "quality_rating")
    private Integer qualityRating;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

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

    /**
     * Take units out of the pack, opening it on first use.
     *
     * @param units units to remove
     * @param today date stamped as opened date on first use
     */
    public void consume(int units, LocalDate today) {
        if (units <= 0 || units > quantityRemaining) {
            throw new IllegalArgumentException("Cannot consume " + units + " units; " + quantityRemaining + " remaining");
        }
        this.quantityRemaining -= units;
        if (!Boolean.TRUE.equals(isOpened)) {
            this.isOpened = true;
            this.openedDate = today;
        }
    }

    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }

    /**
     * Exact text the user must type to confirm deletion.
     */
    public String deletionConfirmationText() {
        return "DELETE " + brand + " " + size;
    }

    public void softDelete(LocalDateTime now) {
        this.isDeleted = true;
        this.deletedAt = now;
    }
}
