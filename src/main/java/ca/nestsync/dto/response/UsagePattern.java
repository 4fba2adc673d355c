package ca.nestsync.dto.response;

import java.util.List;

/**
 * Routine detected from the hours at which changes happen.
 *
 * Scores are percentages in [0, 100].
 */
public record UsagePattern(
        PatternType patternType,
        double confidenceScore,
        String description,
        List<Integer> peakHours,
        List<Integer> lowHours,
        double averageIntervalMinutes,
        double consistencyScore
) {

    public enum PatternType {
        MORNING_PEAK,
        EVENING_PEAK,
        MORNING_EVENING_PEAK,
        NIGHT_HEAVY,
        CONSISTENT,
        IRREGULAR,
        INSUFFICIENT_DATA
    }
}
