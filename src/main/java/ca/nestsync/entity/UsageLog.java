package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One logged diaper change, wipe use or cream application.
 *
 * Database Table: usage_logs
 */
@Entity
@Table(name = "usage_logs", indexes = {
    @Index(name = "idx_usage_child_logged_at", columnList = "child_id, logged_at"),
    @Index(name = "idx_usage_inventory_item_id", columnList = "inventory_item_id"),
    @Index(name = "idx_usage_type", columnList = "usage_type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "child_id", nullable = false)
    private UUID childId;

    /**
     * Inventory item the unit was taken from; null when no matching stock existed.
     */
    @Column(name = "inventory_item_id")
    private UUID inventoryItemId;

    @Column(name = "logged_by", nullable = false)
    private UUID loggedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "usage_type", nullable = false, length = 30)
    private UsageType usageType;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime loggedAt;

    @Column(name = "quantity_used", nullable = false)
    private Integer quantityUsed = 1;

    @Column(name = "was_wet")
    private Boolean wasWet;

    @Column(name = "was_soiled")
    private Boolean wasSoiled;

    @Column(name = "has_leakage")
    private Boolean hasLeakage;

    @Column(name = "product_rating")
    private Integer productRating;

    /**
     * Minutes since the previous logged change of the same child.
     */
    @Column(name = "time_since_last_change")
    private Integer timeSinceLastChange;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_deleted", nullable = false)
    private Boolean isDeleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public void softDelete(LocalDateTime now) {
        this.isDeleted = true;
        this.deletedAt = now;
    }

    public enum UsageType {
        DIAPER_CHANGE,
        WIPE_USE,
        CREAM_APPLICATION
    }
}
