package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummary {

    private LocalDate date;
    private UUID childId;
    private DailyUsageSummary summary;
    private List<HourlyUsage> hourlyBreakdown;
    private List<UsageEvent> usageTimeline;
    private List<String> notablePatterns;
    private List<String> recommendations;
}
