package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Child profile owned by a parent.
 *
 * Drives diaper planning: the current diaper size selects which inventory is
 * consumed by a logged change, and the daily usage count is the baseline for
 * the days-remaining estimate on the dashboard.
 *
 * Database Table: children
 */
@Entity
@Table(name = "children", indexes = {
    @Index(name = "idx_child_parent_id", columnList = "parent_id"),
    @Index(name = "idx_child_is_deleted", columnList = "is_deleted")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Child {

    public static final int DEFAULT_DAILY_USAGE = 8;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Owning user (users.id).
     */
    @Column(name = "parent_id", nullable = false)
    private UUID parentId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", length = 20)
    private Gender gender;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_diaper_size", nullable = false, length = 20)
    private DiaperSize currentDiaperSize = DiaperSize.NEWBORN;

    @Column(name = "current_weight_kg", precision = 5, scale = 2)
    private BigDecimal currentWeightKg;

    @Column(name = "current_height_cm", precision = 5, scale = 1)
    private BigDecimal currentHeightCm;

    @Column(name = "daily_usage_count", nullable = false)
    private Integer dailyUsageCount = DEFAULT_DAILY_USAGE;

    @Column(name = "has_sensitive_skin", nullable = false)
    private Boolean hasSensitiveSkin = false;

    @Column(name = "has_allergies", nullable = false)
    private Boolean hasAllergies = false;

    @Column(name = "allergies_notes", columnDefinition = "TEXT")
    private String allergiesNotes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "preferred_brands", columnDefinition = "jsonb")
    private List<String> preferredBrands = new ArrayList<>();

    @Column(name = "special_needs", columnDefinition = "TEXT")
    private String specialNeeds;

    @Column(name = "onboarding_completed", nullable = false)
    private Boolean onboardingCompleted = false;

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

    public long ageInDays(LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(dateOfBirth, today));
    }

    public long ageInMonths(LocalDate today) {
        return ageInDays(today) / 30;
    }

    public int effectiveDailyUsage() {
        return dailyUsageCount != null && dailyUsageCount > 0 ? dailyUsageCount : DEFAULT_DAILY_USAGE;
    }

    public int weeklyUsage() {
        return effectiveDailyUsage() * 7;
    }

    public int monthlyUsage() {
        return effectiveDailyUsage() * 30;
    }

    public void softDelete(LocalDateTime now) {
        this.isDeleted = true;
        this.deletedAt = now;
    }

    public enum DiaperSize {
        NEWBORN,
        SIZE_1,
        SIZE_2,
        SIZE_3,
        SIZE_4,
        SIZE_5,
        SIZE_6,
        SIZE_7
    }

    public enum Gender {
        BOY,
        GIRL,
        OTHER,
        PREFER_NOT_TO_SAY
    }
}
