package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsagePatterns {

    private UUID childId;
    private int analysisPeriodDays;
    private UsagePattern primaryPattern;
    private List<Integer> peakHours;
    private List<DayOfWeek> peakDaysOfWeek;
    private List<Integer> quietHours;
    private double routineConsistencyScore;
    private List<String> routineRecommendations;
    private List<String> optimizationSuggestions;
}
