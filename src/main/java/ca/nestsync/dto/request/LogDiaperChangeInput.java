package ca.nestsync.dto.request;

import ca.nestsync.entity.UsageLog.UsageType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogDiaperChangeInput {

    @NotNull(message = "Child is required")
    private UUID childId;

    private UsageType usageType = UsageType.DIAPER_CHANGE;

    /**
     * ISO date-time; defaults to now.
     */
    private String loggedAt;

    private Integer quantityUsed = 1;
    private Boolean wasWet;
    private Boolean wasSoiled;
    private Boolean hasLeakage;
    private Integer productRating;
    private String notes;
}
