package ca.nestsync.graphql;

import ca.nestsync.dto.request.AnalyticsFiltersInput;
import ca.nestsync.dto.response.AnalyticsResponse;
import ca.nestsync.dto.response.DailySummary;
import ca.nestsync.dto.response.InventoryInsights;
import ca.nestsync.dto.response.UsageAnalytics;
import ca.nestsync.dto.response.UsagePatterns;
import ca.nestsync.dto.response.WeeklyTrends;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.AnalyticsService;
import ca.nestsync.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.UUID;

/**
 * Usage analytics. Bad ranges and unknown children come back as failure payloads.
 */
@Controller
@RequiredArgsConstructor
public class AnalyticsGraphQlController {

    private final AnalyticsService analyticsService;
    private final UserService userService;

    @QueryMapping
    public AnalyticsResponse<UsageAnalytics> usageAnalytics(@Argument AnalyticsFiltersInput filters) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> analyticsService.getUsageAnalytics(filters, user), AnalyticsResponse::failure);
    }

    @QueryMapping
    public AnalyticsResponse<WeeklyTrends> weeklyTrends(@Argument UUID childId, @Argument Integer weeksBack) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> analyticsService.getWeeklyTrends(childId, weeksBack != null ? weeksBack : 8, user),
                AnalyticsResponse::failure);
    }

    @QueryMapping
    public AnalyticsResponse<DailySummary> dailySummary(@Argument String date, @Argument UUID childId) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> analyticsService.getDailySummary(date, childId, user),
                AnalyticsResponse::failure);
    }

    @QueryMapping
    public AnalyticsResponse<UsagePatterns> usagePatterns(@Argument UUID childId, @Argument Integer analysisDays) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> analyticsService.getUsagePatterns(childId, analysisDays != null ? analysisDays : 30, user),
                AnalyticsResponse::failure);
    }

    @QueryMapping
    public AnalyticsResponse<InventoryInsights> inventoryInsights(@Argument UUID childId) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> analyticsService.getInventoryInsights(childId, user),
                AnalyticsResponse::failure);
    }
}
