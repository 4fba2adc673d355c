package ca.nestsync.dto.request;

import ca.nestsync.entity.Child.DiaperSize;
import ca.nestsync.entity.Child.Gender;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input for adding a child profile.
 *
 * {@code dateOfBirth} is an ISO date (yyyy-MM-dd) and may not be in the future.
 * {@code dailyUsageCount} defaults to 8 and must stay within 1..30.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateChildInput {

    @NotBlank(message = "Child name is required")
    @Size(max = 100, message = "Child name must be at most 100 characters")
    private String name;

    @NotBlank(message = "Date of birth is required")
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
}
