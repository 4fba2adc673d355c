package ca.nestsync.dto.request;

import ca.nestsync.entity.UsageLog.UsageType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsFiltersInput {

    /**
     * One child; all of the caller's own children when null.
     */
    private UUID childId;

    /**
     * yyyy-MM-dd in the caller's timezone; defaults to 30 days before endDate.
     */
    private String startDate;

    /**
     * yyyy-MM-dd in the caller's timezone; defaults to today.
     */
    private String endDate;

    private UsageType usageType;
}
