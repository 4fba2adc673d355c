package ca.nestsync.dto.request;

import ca.nestsync.entity.Child.DiaperSize;
import ca.nestsync.entity.Child.Gender;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial child update; null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateChildInput {

    @Size(max = 100, message = "Child name must be at most 100 characters")
    private String name;

    private String dateOfBirth;
    private Gender gender;
    private DiaperSize currentDiaperSize;
    private BigDecimal currentWeightKg;
    private BigDecimal currentHeightCm;
    private Integer dailyUsageCount;
    private Boolean hasSensitiveSkin;
    private Boolean hasAllergies;
    private String allergiesNotes;
    private List<String> preferredBrands;
    private String specialNeeds;
    private Boolean onboardingCompleted;
}
