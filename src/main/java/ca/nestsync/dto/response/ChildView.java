package ca.nestsync.dto.response;

import ca.nestsync.entity.Child;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Child profile with the usage figures derived from its age and daily usage.
 *
 * Example:
 * <pre>
 * {
 *   "name": "Emma",
 *   "dateOfBirth": "2024-03-01",
 *   "currentDiaperSize": "SIZE_2",
 *   "dailyUsageCount": 8,
 *   "ageInDays": 215,
 *   "ageInMonths": 7,
 *   "weeklyUsage": 56,
 *   "monthlyUsage": 240
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChildView {

    private UUID id;
    private UUID parentId;
    private String name;
    private LocalDate dateOfBirth;
    private Child.Gender gender;
    private Child.DiaperSize currentDiaperSize;
    private BigDecimal currentWeightKg;
    private BigDecimal currentHeightCm;
    private int dailyUsageCount;
    private boolean hasSensitiveSkin;
    private boolean hasAllergies;
    private String allergiesNotes;
    private List<String> preferredBrands;
    private String specialNeeds;
    private boolean onboardingCompleted;
    private long ageInDays;
    private long ageInMonths;
    private int weeklyUsage;
    private int monthlyUsage;
    private LocalDateTime createdAt;

    public static ChildView from(Child child, LocalDate today) {
        return ChildView.builder()
                .id(child.getId())
                .parentId(child.getParentId())
                .name(child.getName())
                .dateOfBirth(child.getDateOfBirth())
                .gender(child.getGender())
                .currentDiaperSize(child.getCurrentDiaperSize())
                .currentWeightKg(child.getCurrentWeightKg())
                .currentHeightCm(child.getCurrentHeightCm())
                .dailyUsageCount(child.effectiveDailyUsage())
                .hasSensitiveSkin(Boolean.TRUE.equals(child.getHasSensitiveSkin()))
                .hasAllergies(Boolean.TRUE.equals(child.getHasAllergies()))
                .allergiesNotes(child.getAllergiesNotes())
                .preferredBrands(child.getPreferredBrands() != null ? child.getPreferredBrands() : List.of())
                .specialNeeds(child.getSpecialNeeds())
                .onboardingCompleted(Boolean.TRUE.equals(child.getOnboardingCompleted()))
                .ageInDays(child.ageInDays(today))
                .ageInMonths(child.ageInMonths(today))
                .weeklyUsage(child.weeklyUsage())
                .monthlyUsage(child.monthlyUsage())
                .createdAt(child.getCreatedAt())
                .build();
    }
}
