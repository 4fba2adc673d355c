package ca.nestsync.service;

import ca.nestsync.dto.response.CostAnalysis;
import ca.nestsync.dto.response.DailyUsageSummary;
import ca.nestsync.dto.response.HourlyUsage;
import ca.nestsync.dto.response.InventoryInsights.ItemInsight;
import ca.nestsync.dto.response.TrendPoint;
import ca.nestsync.dto.response.UsagePattern;
import ca.nestsync.dto.response.UsagePattern.PatternType;
import ca.nestsync.dto.response.WeeklyTrends;
import ca.nestsync.dto.response.WeeklyTrends.TrendDirection;
import ca.nestsync.dto.response.WeeklyTrends.Week;
import ca.nestsync.entity.InventoryItem;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Calculations behind the usage analytics.
 *
 * Every method takes samples in ascending time order and works in the
 * caller's local time. Nothing here touches the database.
 */
final class UsageStatistics {

    static final int MAX_PEAK_HOURS = 6;
    static final double MAX_EXPECTED_INTERVAL_VARIANCE = 14400;
    static final int FULL_CONFIDENCE_SAMPLES = 50;

    private UsageStatistics() {
    }

    static int totalQuantity(List<UsageSample> samples) {
        return samples.stream().mapToInt(UsageSample::quantity).sum();
    }

    /**
     * Changes per day over the days between the first and last sample, inclusive.
     */
    static double dailyAverage(List<UsageSample> samples) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        return round(samples.size() / (double) spanDays(samples), 2);
    }

    static double averageInterval(List<UsageSample> samples) {
        return round(samples.stream()
                .filter(UsageSample::hasInterval)
                .mapToInt(UsageSample::minutesSinceLast)
                .average()
                .orElse(0.0), 2);
    }

    static int weekendCount(List<UsageSample> samples) {
        return (int) samples.stream().filter(s -> isWeekend(s.dayOfWeek())).count();
    }

    /**
     * Consecutive days with at least one change, counted back from today, or
     * from yesterday when nothing has been logged yet today.
     */
    static int currentStreak(List<UsageSample> samples, LocalDate today) {
        List<LocalDate> days = samples.stream().map(UsageSample::date).distinct().toList();
        LocalDate cursor = days.contains(today) ? today : today.minusDays(1);
        int streak = 0;
        while (days.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        return streak;
    }

    /**
     * Share of changes per hour, all 24 hours. The busiest quarter of the hours
     * that saw any change are peak hours.
     */
    static List<HourlyUsage> hourlyDistribution(List<UsageSample> samples) {
        if (samples.isEmpty()) {
            return List.of();
        }
        int[] counts = hourCounts(samples);
        List<Integer> ranked = rankedHours(counts);
        List<Integer> peaks = ranked.subList(0, (int) (ranked.size() * 0.25));

        List<HourlyUsage> distribution = new ArrayList<>(24);
        for (int hour = 0; hour < 24; hour++) {
            double percentage = round(counts[hour] * 100.0 / samples.size(), 2);
            distribution.add(new HourlyUsage(hour, counts[hour], percentage, peaks.contains(hour)));
        }
        return distribution;
    }

    static List<DailyUsageSummary> dailySummaries(List<UsageSample> samples) {
        Map<LocalDate, List<UsageSample>> byDay = new TreeMap<>();
        for (UsageSample sample : samples) {
            byDay.computeIfAbsent(sample.date(), d -> new ArrayList<>()).add(sample);
        }
        List<DailyUsageSummary> summaries = new ArrayList<>(byDay.size());
        byDay.forEach((day, daySamples) -> summaries.add(summarize(day, daySamples)));
        return summaries;
    }

    static DailyUsageSummary summarize(LocalDate day, List<UsageSample> samples) {
        int wetOnly = 0;
        int soiledOnly = 0;
        int both = 0;
        int dry = 0;
        for (UsageSample sample : samples) {
            if (sample.wet() && sample.soiled()) {
                both++;
            } else if (sample.wet()) {
                wetOnly++;
            } else if (sample.soiled()) {
                soiledOnly++;
            } else {
                dry++;
            }
        }
        boolean anyInterval = samples.stream().anyMatch(UsageSample::hasInterval);
        return new DailyUsageSummary(day, samples.size(), wetOnly, soiledOnly, both, dry, totalQuantity(samples),
                anyInterval ? averageInterval(samples) : null);
    }

    /**
     * One point per summarized day with the change from the previous summarized day.
     */
    static List<TrendPoint> trend(List<DailyUsageSummary> summaries) {
        List<TrendPoint> points = new ArrayList<>(summaries.size());
        for (int i = 0; i < summaries.size(); i++) {
            DailyUsageSummary day = summaries.get(i);
            Double change = i > 0 ? percentChange(summaries.get(i - 1).totalChanges(), day.totalChanges()) : null;
            points.add(new TrendPoint(day.date(), day.totalChanges(), day.date().toString(), change));
        }
        return points;
    }

    static UsagePattern analyzePattern(List<UsageSample> samples) {
        if (samples.isEmpty()) {
            return new UsagePattern(PatternType.INSUFFICIENT_DATA, 0.0, describe(PatternType.INSUFFICIENT_DATA),
                    List.of(), quietHours(new int[24]), 0.0, 0.0);
        }
        int[] counts = hourCounts(samples);
        List<Integer> ranked = rankedHours(counts);
        List<Integer> peaks = List.copyOf(ranked.subList(0, Math.min(MAX_PEAK_HOURS, ranked.size())));
        PatternType type = patternType(counts, peaks);

        double consistency = round(consistencyScore(samples, counts), 2);
        double confidence = Math.min(100.0,
                samples.size() / (double) FULL_CONFIDENCE_SAMPLES * 100 * (consistency / 100));

        return new UsagePattern(type, round(confidence, 2), describe(type), peaks, quietHours(counts),
                averageInterval(samples), consistency);
    }

    /**
     * Morning peaks are 6 to 10, evening peaks 18 to 22 and night hours 22 to 6.
     * Without a peak in any of those windows an even spread of hours is consistent.
     */
    static PatternType patternType(int[] counts, List<Integer> peakHours) {
        if (peakHours.isEmpty()) {
            return PatternType.IRREGULAR;
        }
        boolean morning = peakHours.stream().anyMatch(h -> h >= 6 && h <= 10);
        boolean evening = peakHours.stream().anyMatch(h -> h >= 18 && h <= 22);
        boolean night = peakHours.stream().anyMatch(h -> h >= 22 || h <= 6);

        if (morning && evening) {
            return PatternType.MORNING_EVENING_PEAK;
        }
        if (morning) {
            return PatternType.MORNING_PEAK;
        }
        if (evening) {
            return PatternType.EVENING_PEAK;
        }
        if (night) {
            return PatternType.NIGHT_HEAVY;
        }
        return variance(activeCounts(counts)) < 2 ? PatternType.CONSISTENT : PatternType.IRREGULAR;
    }

    /**
     * Mean of interval regularity and hourly spread, each in [0, 100].
     * Zero with no recorded intervals or changes in fewer than two hours.
     */
    static double consistencyScore(List<UsageSample> samples, int[] counts) {
        List<Double> intervals = samples.stream()
                .filter(UsageSample::hasInterval)
                .map(s -> (double) s.minutesSinceLast())
                .toList();
        List<Double> active = activeCounts(counts);
        if (intervals.isEmpty() || active.size() < 2) {
            return 0.0;
        }
        double intervalConsistency = Math.max(0, 100 - variance(intervals) / MAX_EXPECTED_INTERVAL_VARIANCE * 100);
        double mean = mean(active);
        double hourConsistency = mean > 0 ? Math.max(0, 100 - variance(active) / (mean * mean) * 100) : 0;
        return (intervalConsistency + hourConsistency) / 2;
    }

    static List<DayOfWeek> peakDays(List<UsageSample> samples, int limit) {
        Map<DayOfWeek, Long> counts = new TreeMap<>();
        for (UsageSample sample : samples) {
            counts.merge(sample.dayOfWeek(), 1L, Long::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<DayOfWeek, Long>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Monday-based weeks with week-over-week change and a trend over the last three weeks.
     */
    static WeeklyTrends weeklyTrends(List<UsageSample> samples) {
        Map<LocalDate, List<UsageSample>> byWeek = new TreeMap<>();
        for (UsageSample sample : samples) {
            LocalDate monday = sample.date().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            byWeek.computeIfAbsent(monday, d -> new ArrayList<>()).add(sample);
        }

        List<Week> weeks = new ArrayList<>(byWeek.size());
        Integer previous = null;
        for (Map.Entry<LocalDate, List<UsageSample>> entry : byWeek.entrySet()) {
            int total = entry.getValue().size();
            weeks.add(new Week(entry.getKey(), entry.getKey().plusDays(6), total, round(total / 7.0, 2),
                    previous != null ? percentChange(previous, total) : null,
                    analyzePattern(entry.getValue()).patternType()));
            previous = total;
        }

        int current = weeks.isEmpty() ? 0 : weeks.get(weeks.size() - 1).totalChanges();
        int before = weeks.size() > 1 ? weeks.get(weeks.size() - 2).totalChanges() : 0;
        Double change = percentChange(before, current);
        List<Integer> lastThree = weeks.stream()
                .skip(Math.max(0, weeks.size() - 3))
                .map(Week::totalChanges)
                .toList();

        return WeeklyTrends.builder()
                .weeksAnalyzed(weeks.size())
                .currentWeekChanges(current)
                .previousWeekChanges(before)
                .changePercentage(change != null ? change : 0.0)
                .weeklyData(weeks)
                .trendDirection(weeks.size() >= 3 ? trendDirection(lastThree) : TrendDirection.STABLE)
                .peakWeek(weeks.stream().max(Comparator.comparingInt(Week::totalChanges)).orElse(null))
                .lowWeek(weeks.stream().min(Comparator.comparingInt(Week::totalChanges)).orElse(null))
                .averageWeeklyChanges(weeks.isEmpty() ? 0.0 : round(samples.size() / (double) weeks.size(), 2))
                .build();
    }

    /**
     * Least-squares slope of the values against their position; more than half
     * a change per week either way is a trend.
     */
    static TrendDirection trendDirection(List<Integer> values) {
        int n = values.size();
        if (n < 2) {
            return TrendDirection.STABLE;
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        for (int x = 0; x < n; x++) {
            sumX += x;
            sumY += values.get(x);
            sumXY += x * (double) values.get(x);
            sumX2 += x * (double) x;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
        if (slope > 0.5) {
            return TrendDirection.INCREASING;
        }
        if (slope < -0.5) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    /**
     * Spend on the units drawn from priced inventory items.
     */
    static CostAnalysis costAnalysis(List<UsageSample> samples, Map<UUID, InventoryItem> items) {
        if (samples.isEmpty() || items.isEmpty()) {
            return new CostAnalysis(money(BigDecimal.ZERO), money(BigDecimal.ZERO), money(BigDecimal.ZERO), List.of(),
                    "Insufficient data for analysis");
        }

        Map<String, BigDecimal> costByType = new LinkedHashMap<>();
        Map<String, Integer> quantityByType = new LinkedHashMap<>();
        for (UsageSample sample : samples) {
            InventoryItem item = sample.inventoryItemId() != null ? items.get(sample.inventoryItemId()) : null;
            BigDecimal unitCost = item != null ? costPerUnit(item) : null;
            if (unitCost == null) {
                continue;
            }
            costByType.merge(item.getProductType(), unitCost.multiply(BigDecimal.valueOf(sample.quantity())), BigDecimal::add);
            quantityByType.merge(item.getProductType(), sample.quantity(), Integer::sum);
        }

        BigDecimal total = costByType.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal perChange = total.divide(BigDecimal.valueOf(samples.size()), 4, RoundingMode.HALF_UP);
        BigDecimal perDay = total.divide(BigDecimal.valueOf(spanDays(samples)), 4, RoundingMode.HALF_UP);

        List<CostAnalysis.ProductCost> breakdown = new ArrayList<>();
        costByType.forEach((type, cost) -> breakdown.add(new CostAnalysis.ProductCost(
                type,
                quantityByType.get(type),
                money(cost),
                total.signum() > 0 ? round(cost.doubleValue() / total.doubleValue() * 100, 2) : 0.0)));

        return new CostAnalysis(money(total), money(perChange), money(perDay), breakdown, budgetRecommendation(perDay));
    }

    static String budgetRecommendation(BigDecimal costPerDay) {
        double monthly = costPerDay.doubleValue() * 30;
        if (monthly < 50) {
            return "Budget is very reasonable for diaper expenses";
        }
        if (monthly < 100) {
            return "Good budget management - consider bulk purchases for savings";
        }
        if (monthly < 150) {
            return "Average spending - look for deals and promotions";
        }
        return "Consider reviewing brand choices or bulk purchasing to reduce costs";
    }

    /**
     * Outlook for one item from the samples that drew from it.
     */
    static ItemInsight itemInsight(InventoryItem item, List<UsageSample> drawn) {
        int stock = item.getQuantityRemaining() != null ? item.getQuantityRemaining() : 0;
        if (drawn.isEmpty()) {
            return new ItemInsight(item.getId(), item.getProductType(), item.getBrand(), item.getSize(), stock,
                    0.0, null, "No usage data available", null, null);
        }

        double rate = totalQuantity(drawn) / (double) spanDays(drawn);
        Double daysRemaining = rate > 0 ? round(stock / rate, 1) : null;
        BigDecimal unitCost = costPerUnit(item);
        BigDecimal costPerDay = unitCost != null && rate > 0 ? money(unitCost.multiply(BigDecimal.valueOf(rate))) : null;

        return new ItemInsight(item.getId(), item.getProductType(), item.getBrand(), item.getSize(), stock,
                round(rate, 2), daysRemaining, reorderRecommendation(rate, daysRemaining), costPerDay,
                efficiencyRating(item.getProductType(), rate));
    }

    static String reorderRecommendation(double dailyRate, Double daysRemaining) {
        if (dailyRate <= 0) {
            return "Monitor usage patterns";
        }
        if (daysRemaining == null) {
            return "Unable to calculate - insufficient data";
        }
        if (daysRemaining <= 3) {
            return "URGENT: Reorder immediately";
        }
        if (daysRemaining <= 7) {
            return "Reorder soon - less than a week remaining";
        }
        if (daysRemaining <= 14) {
            return "Consider reordering within the next week";
        }
        if (daysRemaining <= 30) {
            return "Stock levels good for now";
        }
        return "Well stocked";
    }

    static String efficiencyRating(String productType, double dailyRate) {
        if (dailyRate <= 0) {
            return "unknown";
        }
        if (!InventoryItem.TYPE_DIAPER.equals(productType)) {
            return "good";
        }
        if (dailyRate <= 4) {
            return "excellent";
        }
        if (dailyRate <= 6) {
            return "good";
        }
        if (dailyRate <= 8) {
            return "fair";
        }
        return "review_needed";
    }

    /**
     * Pack cost spread over the pack size, or null for an unpriced pack.
     */
    static BigDecimal costPerUnit(InventoryItem item) {
        if (item.getCostCad() == null || item.getQuantityTotal() == null || item.getQuantityTotal() <= 0) {
            return null;
        }
        return item.getCostCad().divide(BigDecimal.valueOf(item.getQuantityTotal()), 4, RoundingMode.HALF_UP);
    }

    static List<String> notablePatterns(DailyUsageSummary day) {
        List<String> notes = new ArrayList<>();
        if (day.totalChanges() > 10) {
            notes.add("High frequency day - more changes than usual");
        } else if (day.totalChanges() < 3) {
            notes.add("Low frequency day - fewer changes than usual");
        }
        if (day.wetAndSoiled() > day.wetOnly() + day.soiledOnly()) {
            notes.add("Many combined wet and soiled diapers");
        }
        return notes;
    }

    static List<String> dailyRecommendations(DailyUsageSummary day) {
        List<String> recommendations = new ArrayList<>();
        if (day.averageIntervalMinutes() != null && day.averageIntervalMinutes() < 120) {
            recommendations.add("Consider checking diaper fit if changes are very frequent");
        }
        recommendations.add("Monitor hydration and feeding patterns");
        return recommendations;
    }

    static String describe(PatternType type) {
        String words = type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return "Usage pattern: " + Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * Percentage change, or null when there is nothing to compare against.
     */
    static Double percentChange(int previous, int current) {
        if (previous <= 0) {
            return null;
        }
        return round((current - previous) * 100.0 / previous, 2);
    }

    private static long spanDays(List<UsageSample> samples) {
        LocalDate first = samples.get(0).date();
        LocalDate last = samples.get(samples.size() - 1).date();
        return ChronoUnit.DAYS.between(first, last) + 1;
    }

    private static int[] hourCounts(List<UsageSample> samples) {
        int[] counts = new int[24];
        for (UsageSample sample : samples) {
            counts[sample.hour()]++;
        }
        return counts;
    }

    // busiest first, earlier hour first on ties; hours without changes left out
    private static List<Integer> rankedHours(int[] counts) {
        List<Integer> hours = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            if (counts[hour] > 0) {
                hours.add(hour);
            }
        }
        hours.sort(Comparator.comparingInt((Integer h) -> counts[h]).reversed().thenComparingInt(h -> h));
        return hours;
    }

    private static List<Integer> quietHours(int[] counts) {
        List<Integer> quiet = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            if (counts[hour] == 0) {
                quiet.add(hour);
            }
        }
        return quiet;
    }

    private static List<Double> activeCounts(int[] counts) {
        List<Double> active = new ArrayList<>();
        for (int count : counts) {
            if (count > 0) {
                active.add((double) count);
            }
        }
        return active;
    }

    private static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    // sample variance, 0 for fewer than two values
    private static double variance(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / (values.size() - 1);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
