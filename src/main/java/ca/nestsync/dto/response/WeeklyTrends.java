package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Week-over-week change counts. Weeks start on Monday.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyTrends {

    private UUID childId;
    private int weeksAnalyzed;
    private int currentWeekChanges;
    private int previousWeekChanges;
    private double changePercentage;
    private List<Week> weeklyData;
    private TrendDirection trendDirection;
    private Week peakWeek;
    private Week lowWeek;
    private double averageWeeklyChanges;

    public enum TrendDirection {
        INCREASING,
        DECREASING,
        STABLE
    }

    /**
     * @param changeFromPrevious percentage change from the week before, null for
     *                           the first week or when the week before had none
     */
    public record Week(LocalDate weekStart, LocalDate weekEnd, int totalChanges, double dailyAverage,
                       Double changeFromPrevious, UsagePattern.PatternType patternType) {
    }
}
