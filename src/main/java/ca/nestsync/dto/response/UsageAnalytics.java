package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Usage statistics over a date range for one child or all of the caller's children.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageAnalytics {

    private LocalDate startDate;
    private LocalDate endDate;
    private UUID childId;

    private int totalChanges;
    private int totalQuantity;
    private double dailyAverage;

    private int wetOnlyCount;
    private int soiledOnlyCount;
    private int wetAndSoiledCount;
    private int dryChangesCount;

    private int weekdayCount;
    private int weekendCount;
    private int currentStreak;
    private double averageIntervalMinutes;

    private UsagePattern usagePattern;
    private List<HourlyUsage> hourlyDistribution;
    private List<DailyUsageSummary> dailySummaries;
    private List<TrendPoint> trendData;
    private CostAnalysis costAnalysis;
}
