package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.AnalyticsFiltersInput;
import ca.nestsync.dto.response.AnalyticsResponse;
import ca.nestsync.dto.response.DailySummary;
import ca.nestsync.dto.response.DailyUsageSummary;
import ca.nestsync.dto.response.InventoryInsights;
import ca.nestsync.dto.response.InventoryInsights.ItemInsight;
import ca.nestsync.dto.response.TrendPoint;
import ca.nestsync.dto.response.UsageAnalytics;
import ca.nestsync.dto.response.UsageEvent;
import ca.nestsync.dto.response.UsagePattern;
import ca.nestsync.dto.response.UsagePatterns;
import ca.nestsync.dto.response.WeeklyTrends;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.InventoryItem;
import ca.nestsync.entity.UsageLog.UsageType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.InventoryItemRepository;
import ca.nestsync.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Usage analytics over the caller's children.
 *
 * Each query covers one accessible child, or every child the caller owns when
 * no child is given, and needs the caller's analytics consent. Days and hours
 * are those of the caller's timezone; stored timestamps are UTC.
 *
 * @see UsageStatistics
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalyticsService {

    static final String CONSENT_REQUIRED =
            "Analytics consent required. Please grant analytics consent in your privacy settings.";
    static final int DEFAULT_RANGE_DAYS = 30;
    static final int MAX_RANGE_DAYS = 365;
    static final int INSIGHT_WINDOW_DAYS = 30;
    static final List<String> COST_TIPS = List.of(
            "Consider bulk purchases for frequently used items",
            "Compare prices across different brands",
            "Monitor sales and promotions for your preferred brands");

    private final UsageLogRepository usageLogRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final ChildRepository childRepository;
    private final ChildService childService;
    private final AppSettings appSettings;

    @Transactional(readOnly = true)
    public AnalyticsResponse<UsageAnalytics> getUsageAnalytics(AnalyticsFiltersInput filters, UserProfile user) {
        if (!hasConsent(user)) {
            return AnalyticsResponse.failure(CONSENT_REQUIRED);
        }
        AnalyticsFiltersInput criteria = filters != null ? filters : new AnalyticsFiltersInput();
        ZoneId zone = zoneOf(user);
        LocalDate today = LocalDate.now(zone);
        LocalDate end = parseDate(criteria.getEndDate(), "endDate", today);
        LocalDate start = parseDate(criteria.getStartDate(), "startDate", end.minusDays(DEFAULT_RANGE_DAYS));
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }
        if (ChronoUnit.DAYS.between(start, end) > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("Date range cannot exceed " + MAX_RANGE_DAYS + " days");
        }

        List<UUID> childIds = scope(criteria.getChildId(), user);
        List<UsageSample> samples = load(childIds, criteria.getUsageType(), start, end, zone);
        logAccess(user, "usage_analytics", samples.size());
        if (samples.isEmpty()) {
            return AnalyticsResponse.empty("No usage data found for the specified period");
        }

        List<DailyUsageSummary> days = UsageStatistics.dailySummaries(samples);
        Map<UUID, InventoryItem> items = childIds.isEmpty() ? Map.of()
                : inventoryItemRepository.findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(childIds).stream()
                        .collect(Collectors.toMap(InventoryItem::getId, Function.identity()));
        int weekend = UsageStatistics.weekendCount(samples);

        UsageAnalytics analytics = UsageAnalytics.builder()
                .startDate(start)
                .endDate(end)
                .childId(criteria.getChildId())
                .totalChanges(samples.size())
                .totalQuantity(UsageStatistics.totalQuantity(samples))
                .dailyAverage(UsageStatistics.dailyAverage(samples))
                .wetOnlyCount(days.stream().mapToInt(DailyUsageSummary::wetOnly).sum())
                .soiledOnlyCount(days.stream().mapToInt(DailyUsageSummary::soiledOnly).sum())
                .wetAndSoiledCount(days.stream().mapToInt(DailyUsageSummary::wetAndSoiled).sum())
                .dryChangesCount(days.stream().mapToInt(DailyUsageSummary::dryChanges).sum())
                .weekdayCount(samples.size() - weekend)
                .weekendCount(weekend)
                .currentStreak(UsageStatistics.currentStreak(samples, today))
                .averageIntervalMinutes(UsageStatistics.averageInterval(samples))
                .usagePattern(UsageStatistics.analyzePattern(samples))
                .hourlyDistribution(UsageStatistics.hourlyDistribution(samples))
                .dailySummaries(days)
                .trendData(UsageStatistics.trend(days))
                .costAnalysis(UsageStatistics.costAnalysis(samples, items))
                .build();
        return AnalyticsResponse.ok(analytics, samples.size(), "Usage analytics calculated successfully");
    }

    /**
     * Diaper changes per Monday-based week over the last {@code weeksBack} weeks.
     */
    @Transactional(readOnly = true)
    public AnalyticsResponse<WeeklyTrends> getWeeklyTrends(UUID childId, int weeksBack, UserProfile user) {
        if (!hasConsent(user)) {
            return AnalyticsResponse.failure(CONSENT_REQUIRED);
        }
        if (weeksBack < 1 || weeksBack > 52) {
            throw new IllegalArgumentException("weeksBack must be between 1 and 52");
        }
        ZoneId zone = zoneOf(user);
        LocalDate today = LocalDate.now(zone);
        List<UsageSample> samples = load(scope(childId, user), UsageType.DIAPER_CHANGE,
                today.minusWeeks(weeksBack), today, zone);
        logAccess(user, "weekly_trends", samples.size());
        if (samples.isEmpty()) {
            return AnalyticsResponse.empty("No usage data found for weekly trends");
        }

        WeeklyTrends trends = UsageStatistics.weeklyTrends(samples);
        trends.setChildId(childId);
        return AnalyticsResponse.ok(trends, samples.size(), "Weekly trends calculated successfully");
    }

    @Transactional(readOnly = true)
    public AnalyticsResponse<DailySummary> getDailySummary(String date, UUID childId, UserProfile user) {
        if (!hasConsent(user)) {
            return AnalyticsResponse.failure(CONSENT_REQUIRED);
        }
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("date is required");
        }
        ZoneId zone = zoneOf(user);
        LocalDate day = parseDate(date, "date", null);
        List<UsageSample> samples = load(scope(childId, user), UsageType.DIAPER_CHANGE, day, day, zone);
        logAccess(user, "daily_summary", samples.size());
        if (samples.isEmpty()) {
            return AnalyticsResponse.empty("No usage data found for " + day);
        }

        DailyUsageSummary summary = UsageStatistics.summarize(day, samples);
        List<UsageEvent> timeline = samples.stream()
                .map(s -> new UsageEvent(s.localTime(), s.quantity(), s.hour(), s.dayOfWeek(), s.wet(), s.soiled(),
                        s.minutesSinceLast()))
                .toList();
        DailySummary result = DailySummary.builder()
                .date(day)
                .childId(childId)
                .summary(summary)
                .hourlyBreakdown(UsageStatistics.hourlyDistribution(samples))
                .usageTimeline(timeline)
                .notablePatterns(UsageStatistics.notablePatterns(summary))
                .recommendations(UsageStatistics.dailyRecommendations(summary))
                .build();
        return AnalyticsResponse.ok(result, samples.size(), "Daily summary calculated successfully");
    }

    @Transactional(readOnly = true)
    public AnalyticsResponse<UsagePatterns> getUsagePatterns(UUID childId, int analysisDays, UserProfile user) {
        if (!hasConsent(user)) {
            return AnalyticsResponse.failure(CONSENT_REQUIRED);
        }
        if (analysisDays < 1 || analysisDays > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("analysisDays must be between 1 and " + MAX_RANGE_DAYS);
        }
        ZoneId zone = zoneOf(user);
        LocalDate today = LocalDate.now(zone);
        List<UsageSample> samples = load(scope(childId, user), UsageType.DIAPER_CHANGE,
                today.minusDays(analysisDays), today, zone);
        logAccess(user, "usage_patterns", samples.size());
        if (samples.isEmpty()) {
            return AnalyticsResponse.empty("No usage data found for pattern analysis");
        }

        UsagePattern pattern = UsageStatistics.analyzePattern(samples);
        List<String> suggestions = new ArrayList<>(List.of(
                "Stock more supplies during peak usage times",
                "Plan outings around quieter periods when possible"));
        if (pattern.consistencyScore() < 50) {
            suggestions.add("Consider establishing a more regular routine");
        }

        UsagePatterns patterns = UsagePatterns.builder()
                .childId(childId)
                .analysisPeriodDays(analysisDays)
                .primaryPattern(pattern)
                .peakHours(pattern.peakHours())
                .peakDaysOfWeek(UsageStatistics.peakDays(samples, 3))
                .quietHours(pattern.lowHours())
                .routineConsistencyScore(pattern.consistencyScore())
                .routineRecommendations(List.of(
                        "Maintain consistent change times during peak hours",
                        "Consider preventive changes before busy periods"))
                .optimizationSuggestions(suggestions)
                .build();
        return AnalyticsResponse.ok(patterns, samples.size(), "Usage patterns analyzed successfully");
    }

    /**
     * Per-item consumption over the last 30 days with reorder advice. Items under
     * a week of stock raise a low-stock alert.
     */
    @Transactional(readOnly = true)
    public AnalyticsResponse<InventoryInsights> getInventoryInsights(UUID childId, UserProfile user) {
        if (!hasConsent(user)) {
            return AnalyticsResponse.failure(CONSENT_REQUIRED);
        }
        List<UUID> childIds = scope(childId, user);
        List<InventoryItem> items = childIds.isEmpty() ? List.of()
                : inventoryItemRepository.findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(childIds);
        if (items.isEmpty()) {
            logAccess(user, "inventory_insights", 0);
            return AnalyticsResponse.empty("No inventory items found");
        }

        ZoneId zone = zoneOf(user);
        LocalDate today = LocalDate.now(zone);
        List<UsageSample> samples = load(childIds, null, today.minusDays(INSIGHT_WINDOW_DAYS), today, zone);
        logAccess(user, "inventory_insights", samples.size() + items.size());

        Map<UUID, List<UsageSample>> drawnByItem = samples.stream()
                .filter(s -> s.inventoryItemId() != null)
                .collect(Collectors.groupingBy(UsageSample::inventoryItemId));
        List<ItemInsight> insights = items.stream()
                .map(item -> UsageStatistics.itemInsight(item, drawnByItem.getOrDefault(item.getId(), List.of())))
                .toList();

        List<String> alerts = insights.stream()
                .filter(i -> i.daysRemaining() != null && i.daysRemaining() <= 7)
                .map(i -> String.format(Locale.ROOT, "Low stock: %s %s - %.1f days remaining",
                        i.brand(), i.size(), i.daysRemaining()))
                .toList();

        List<TrendPoint> trend = new ArrayList<>(7);
        for (int daysAgo = 6; daysAgo >= 0; daysAgo--) {
            LocalDate day = today.minusDays(daysAgo);
            int count = (int) samples.stream().filter(s -> s.date().equals(day)).count();
            trend.add(new TrendPoint(day, count, day.toString(), null));
        }

        InventoryInsights result = InventoryInsights.builder()
                .childId(childId)
                .currentItems(insights)
                .consumptionTrends(trend)
                .reorderAlerts(alerts)
                .costOptimizationTips(COST_TIPS)
                .build();
        return AnalyticsResponse.ok(result, samples.size() + items.size(), "Inventory insights calculated successfully");
    }

    private boolean hasConsent(UserProfile user) {
        if (!Boolean.TRUE.equals(user.getAnalyticsConsent())) {
            log.info("Analytics refused for user {}: no analytics consent", user.getId());
            return false;
        }
        return true;
    }

    /**
     * The one accessible child asked for, or every child the caller owns.
     */
    private List<UUID> scope(UUID childId, UserProfile user) {
        if (childId != null) {
            return List.of(childService.requireAccessibleChild(childId, user).getId());
        }
        return childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId()).stream()
                .map(Child::getId)
                .toList();
    }

    // local days [from, to] inclusive, converted to the UTC bounds the logs are stored in
    private List<UsageSample> load(List<UUID> childIds, UsageType usageType, LocalDate from, LocalDate to, ZoneId zone) {
        if (childIds.isEmpty()) {
            return List.of();
        }
        LocalDateTime start = from.atStartOfDay(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        LocalDateTime end = to.plusDays(1).atStartOfDay(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        return usageLogRepository.findInRange(childIds, usageType, start, end).stream()
                .map(usageLog -> UsageSample.of(usageLog, zone))
                .toList();
    }

    private ZoneId zoneOf(UserProfile user) {
        if (user.getTimezone() != null) {
            try {
                return ZoneId.of(user.getTimezone());
            } catch (DateTimeException ex) {
                log.warn("Unknown timezone '{}' for user {}, using {}", user.getTimezone(), user.getId(),
                        appSettings.getDefaultTimezone());
            }
        }
        return ZoneId.of(appSettings.getDefaultTimezone());
    }

    private void logAccess(UserProfile user, String dataType, int dataPoints) {
        log.info("Analytics access: user {} read {} ({} data points)", user.getId(), dataType, dataPoints);
    }

    private LocalDate parseDate(String value, String label, LocalDate fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(label + " must be in yyyy-MM-dd format");
        }
    }
}
