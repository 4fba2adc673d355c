package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.AnalyticsFiltersInput;
import ca.nestsync.dto.response.AnalyticsResponse;
import ca.nestsync.dto.response.DailySummary;
import ca.nestsync.dto.response.InventoryInsights;
import ca.nestsync.dto.response.UsageAnalytics;
import ca.nestsync.dto.response.UsagePatterns;
import ca.nestsync.dto.response.WeeklyTrends;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.InventoryItem;
import ca.nestsync.entity.UsageLog;
import ca.nestsync.entity.UsageLog.UsageType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.InventoryItemRepository;
import ca.nestsync.repository.UsageLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsService.
 *
 * Tests how the analytics queries are scoped and guarded:
 * - Analytics consent and child access checks
 * - Local date ranges turned into UTC query bounds
 * - Empty periods, range validation and the assembled results
 *
 * @see ca.nestsync.service.AnalyticsService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsService Unit Tests")
class AnalyticsServiceTest {

    private static final ZoneId TORONTO = ZoneId.of("America/Toronto");

    @Mock
    private UsageLogRepository usageLogRepository;

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    @Mock
    private ChildRepository childRepository;

    @Mock
    private ChildService childService;

    @Mock
    private AppSettings appSettings;

    @InjectMocks
    private AnalyticsService analyticsService;

    private UserProfile user;
    private Child child;

    @BeforeEach
    void setUp() {
        user = new UserProfile();
        user.setId(UUID.randomUUID());
        user.setTimezone("America/Toronto");
        user.setAnalyticsConsent(true);

        child = new Child();
        child.setId(UUID.randomUUID());
        child.setParentId(user.getId());
        child.setName("Emma");
    }

    private UsageLog change(LocalDateTime loggedAtUtc, boolean wet, boolean soiled, Integer interval, UUID itemId) {
        UsageLog log = new UsageLog();
        log.setId(UUID.randomUUID());
        log.setChildId(child.getId());
        log.setUsageType(UsageType.DIAPER_CHANGE);
        log.setLoggedAt(loggedAtUtc);
        log.setQuantityUsed(1);
        log.setWasWet(wet);
        log.setWasSoiled(soiled);
        log.setTimeSinceLastChange(interval);
        log.setInventoryItemId(itemId);
        return log;
    }

    private InventoryItem pack(int remaining) {
        InventoryItem item = new InventoryItem();
        item.setId(UUID.randomUUID());
        item.setChildId(child.getId());
        item.setProductType(InventoryItem.TYPE_DIAPER);
        item.setBrand("Huggies");
        item.setSize("SIZE_2");
        item.setQuantityTotal(60);
        item.setQuantityRemaining(remaining);
        item.setCostCad(new BigDecimal("30.00"));
        return item;
    }

    private AnalyticsFiltersInput range(String start, String end) {
        AnalyticsFiltersInput filters = new AnalyticsFiltersInput();
        filters.setStartDate(start);
        filters.setEndDate(end);
        return filters;
    }

    @Test
    @DisplayName("Without analytics consent nothing is read")
    void testConsentRequired() {
        // Arrange
        user.setAnalyticsConsent(false);

        // Act
        AnalyticsResponse<UsageAnalytics> usage = analyticsService.getUsageAnalytics(null, user);
        AnalyticsResponse<InventoryInsights> insights = analyticsService.getInventoryInsights(child.getId(), user);

        // Assert
        assertFalse(usage.isSuccess());
        assertEquals(AnalyticsService.CONSENT_REQUIRED, usage.getError());
        assertNull(usage.getData());
        assertFalse(insights.isSuccess());
        verifyNoInteractions(usageLogRepository, inventoryItemRepository, childRepository, childService);
    }

    @Test
    @DisplayName("Usage analytics covers every owned child over the local date range")
    void testUsageAnalyticsForOwnedChildren() {
        // Arrange
        InventoryItem item = pack(40);
        List<UsageLog> logs = List.of(
                change(LocalDateTime.of(2026, 3, 2, 12, 0), true, false, null, item.getId()),
                change(LocalDateTime.of(2026, 3, 2, 16, 0), false, true, 240, item.getId()),
                change(LocalDateTime.of(2026, 3, 3, 13, 0), true, true, 180, item.getId()),
                change(LocalDateTime.of(2026, 3, 7, 15, 0), false, false, 120, null));
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of(child));
        when(usageLogRepository.findInRange(eq(List.of(child.getId())), isNull(), any(LocalDateTime.class),
                any(LocalDateTime.class))).thenReturn(logs);
        when(inventoryItemRepository.findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(List.of(child.getId())))
                .thenReturn(List.of(item));

        // Act
        AnalyticsResponse<UsageAnalytics> response =
                analyticsService.getUsageAnalytics(range("2026-03-01", "2026-03-07"), user);

        // Assert
        ArgumentCaptor<LocalDateTime> from = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> to = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(usageLogRepository).findInRange(anyCollection(), isNull(), from.capture(), to.capture());
        assertEquals(LocalDateTime.of(2026, 3, 1, 5, 0), from.getValue());
        assertEquals(LocalDateTime.of(2026, 3, 8, 5, 0), to.getValue());

        assertTrue(response.isSuccess());
        assertEquals(4, response.getDataPointsAnalyzed());
        UsageAnalytics analytics = response.getData();
        assertEquals(LocalDate.of(2026, 3, 1), analytics.getStartDate());
        assertEquals(4, analytics.getTotalChanges());
        assertEquals(1, analytics.getWetOnlyCount());
        assertEquals(1, analytics.getSoiledOnlyCount());
        assertEquals(1, analytics.getWetAndSoiledCount());
        assertEquals(1, analytics.getDryChangesCount());
        assertEquals(3, analytics.getWeekdayCount());
        assertEquals(1, analytics.getWeekendCount());
        assertEquals(0, analytics.getCurrentStreak());
        assertEquals(180.0, analytics.getAverageIntervalMinutes());
        assertEquals(3, analytics.getDailySummaries().size());
        assertEquals(new BigDecimal("1.50"), analytics.getCostAnalysis().totalCost());
        assertEquals(7, analytics.getHourlyDistribution().get(7).hour());
        assertEquals(1, analytics.getHourlyDistribution().get(7).count());
        verifyNoInteractions(childService);
    }

    @Test
    @DisplayName("A child the caller cannot reach is reported as not found")
    void testUsageAnalyticsForInaccessibleChild() {
        // Arrange
        AnalyticsFiltersInput filters = range(null, null);
        filters.setChildId(child.getId());
        when(childService.requireAccessibleChild(child.getId(), user)).thenThrow(ResourceNotFoundException.child(child.getId()));

        // Act & Assert
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> analyticsService.getUsageAnalytics(filters, user));
        assertEquals("Child not found", ex.getMessage());
        verifyNoInteractions(usageLogRepository, childRepository);
    }

    @Test
    @DisplayName("Reversed and over-long date ranges are rejected")
    void testUsageAnalyticsRangeValidation() {
        // Act & Assert
        IllegalArgumentException reversed = assertThrows(IllegalArgumentException.class,
                () -> analyticsService.getUsageAnalytics(range("2026-03-07", "2026-03-01"), user));
        IllegalArgumentException tooLong = assertThrows(IllegalArgumentException.class,
                () -> analyticsService.getUsageAnalytics(range("2025-01-01", "2026-03-01"), user));
        IllegalArgumentException malformed = assertThrows(IllegalArgumentException.class,
                () -> analyticsService.getUsageAnalytics(range("03/01/2026", null), user));

        assertEquals("Start date must not be after end date", reversed.getMessage());
        assertEquals("Date range cannot exceed 365 days", tooLong.getMessage());
        assertEquals("startDate must be in yyyy-MM-dd format", malformed.getMessage());
        verifyNoInteractions(usageLogRepository);
    }

    @Test
    @DisplayName("A caller without children gets an empty result, not an error")
    void testUsageAnalyticsWithoutChildren() {
        // Arrange
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of());

        // Act
        AnalyticsResponse<UsageAnalytics> response = analyticsService.getUsageAnalytics(null, user);

        // Assert
        assertTrue(response.isSuccess());
        assertNull(response.getData());
        assertEquals("No usage data found for the specified period", response.getMessage());
        verifyNoInteractions(usageLogRepository, inventoryItemRepository);
    }

    @Test
    @DisplayName("An unknown profile timezone falls back to the configured default")
    void testUnknownTimezoneFallsBack() {
        // Arrange
        user.setTimezone("Mars/Olympus");
        when(appSettings.getDefaultTimezone()).thenReturn("America/Vancouver");
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of(child));
        when(usageLogRepository.findInRange(anyCollection(), isNull(), any(LocalDateTime.class), any(LocalDateTime.class)))
                .thenReturn(List.of());

        // Act
        analyticsService.getUsageAnalytics(range("2026-03-01", "2026-03-01"), user);

        // Assert
        verify(usageLogRepository).findInRange(anyCollection(), isNull(),
                eq(LocalDateTime.of(2026, 3, 1, 8, 0)), eq(LocalDateTime.of(2026, 3, 2, 8, 0)));
    }

    @Test
    @DisplayName("Weekly trends read diaper changes of the requested child only")
    void testWeeklyTrends() {
        // Arrange
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(usageLogRepository.findInRange(eq(List.of(child.getId())), eq(UsageType.DIAPER_CHANGE),
                any(LocalDateTime.class), any(LocalDateTime.class)))
                .thenReturn(List.of(change(now.minusDays(8), true, false, null, null), change(now, true, false, 200, null)));

        // Act
        AnalyticsResponse<WeeklyTrends> response = analyticsService.getWeeklyTrends(child.getId(), 4, user);

        // Assert
        assertTrue(response.isSuccess());
        assertEquals(2, response.getDataPointsAnalyzed());
        assertEquals(child.getId(), response.getData().getChildId());
        assertEquals(WeeklyTrends.TrendDirection.STABLE, response.getData().getTrendDirection());
        verifyNoInteractions(childRepository);
    }

    @Test
    @DisplayName("Weeks back outside 1 to 52 is rejected")
    void testWeeklyTrendsValidation() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> analyticsService.getWeeklyTrends(null, 53, user));
        assertEquals("weeksBack must be between 1 and 52", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getWeeklyTrends(null, 0, user));
    }

    @Test
    @DisplayName("A daily summary lays out the day in local time")
    void testDailySummary() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(usageLogRepository.findInRange(List.of(child.getId()), UsageType.DIAPER_CHANGE,
                LocalDateTime.of(2026, 3, 4, 5, 0), LocalDateTime.of(2026, 3, 5, 5, 0)))
                .thenReturn(List.of(
                        change(LocalDateTime.of(2026, 3, 4, 14, 0), true, false, 150, null),
                        change(LocalDateTime.of(2026, 3, 4, 15, 40), true, true, 100, null)));

        // Act
        AnalyticsResponse<DailySummary> response = analyticsService.getDailySummary("2026-03-04", child.getId(), user);

        // Assert
        DailySummary summary = response.getData();
        assertEquals(2, summary.getSummary().totalChanges());
        assertEquals(125.0, summary.getSummary().averageIntervalMinutes());
        assertEquals(9, summary.getUsageTimeline().get(0).hourOfDay());
        assertEquals(LocalDateTime.of(2026, 3, 4, 10, 40), summary.getUsageTimeline().get(1).timestamp());
        assertEquals(List.of("Low frequency day - fewer changes than usual"), summary.getNotablePatterns());
        assertEquals(List.of("Monitor hydration and feeding patterns"), summary.getRecommendations());
    }

    @Test
    @DisplayName("A day with no changes says so")
    void testDailySummaryWithoutData() {
        // Arrange
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of(child));
        when(usageLogRepository.findInRange(anyCollection(), eq(UsageType.DIAPER_CHANGE), any(LocalDateTime.class),
                any(LocalDateTime.class))).thenReturn(List.of());

        // Act
        AnalyticsResponse<DailySummary> response = analyticsService.getDailySummary("2026-03-04", null, user);

        // Assert
        assertTrue(response.isSuccess());
        assertEquals("No usage data found for 2026-03-04", response.getMessage());
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getDailySummary(" ", null, user));
    }

    @Test
    @DisplayName("An irregular routine earns the suggestion to establish one")
    void testUsagePatterns() {
        // Arrange
        LocalDate today = LocalDate.now(TORONTO);
        List<UsageLog> logs = new ArrayList<>();
        logs.add(change(today.minusDays(3).atTime(12, 0), true, false, 30, null));
        logs.add(change(today.minusDays(3).atTime(13, 0), true, false, 600, null));
        logs.add(change(today.minusDays(2).atTime(13, 0), true, false, 1400, null));
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of(child));
        when(usageLogRepository.findInRange(anyCollection(), eq(UsageType.DIAPER_CHANGE), any(LocalDateTime.class),
                any(LocalDateTime.class))).thenReturn(logs);

        // Act
        AnalyticsResponse<UsagePatterns> response = analyticsService.getUsagePatterns(null, 14, user);

        // Assert
        UsagePatterns patterns = response.getData();
        assertEquals(14, patterns.getAnalysisPeriodDays());
        assertTrue(patterns.getRoutineConsistencyScore() < 50);
        assertTrue(patterns.getOptimizationSuggestions().contains("Consider establishing a more regular routine"));
        assertEquals(patterns.getPrimaryPattern().peakHours(), patterns.getPeakHours());
        assertEquals(22, patterns.getQuietHours().size());
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getUsagePatterns(null, 366, user));
    }

    @Test
    @DisplayName("Items running out within a week raise a low-stock alert")
    void testInventoryInsights() {
        // Arrange
        InventoryItem low = pack(6);
        InventoryItem idle = pack(60);
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        List<UsageLog> logs = new ArrayList<>();
        for (int i = 9; i >= 0; i--) {
            logs.add(change(now.minusDays(i / 2).minusHours(i % 2), true, false, null, low.getId()));
        }
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(inventoryItemRepository.findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(List.of(child.getId())))
                .thenReturn(List.of(low, idle));
        when(usageLogRepository.findInRange(eq(List.of(child.getId())), isNull(), any(LocalDateTime.class),
                any(LocalDateTime.class))).thenReturn(logs);

        // Act
        AnalyticsResponse<InventoryInsights> response = analyticsService.getInventoryInsights(child.getId(), user);

        // Assert
        InventoryInsights insights = response.getData();
        assertEquals(12, response.getDataPointsAnalyzed());
        assertEquals(2, insights.getCurrentItems().size());
        assertTrue(insights.getCurrentItems().get(0).daysRemaining() <= 7);
        assertEquals("No usage data available", insights.getCurrentItems().get(1).reorderRecommendation());
        assertEquals(1, insights.getReorderAlerts().size());
        assertTrue(insights.getReorderAlerts().get(0).startsWith("Low stock: Huggies SIZE_2 - "));
        assertEquals(7, insights.getConsumptionTrends().size());
        assertEquals(LocalDate.now(TORONTO), insights.getConsumptionTrends().get(6).date());
        assertEquals(AnalyticsService.COST_TIPS, insights.getCostOptimizationTips());
    }

    @Test
    @DisplayName("Without inventory the usage logs are not read")
    void testInventoryInsightsWithoutItems() {
        // Arrange
        when(childRepository.findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(user.getId())).thenReturn(List.of(child));
        when(inventoryItemRepository.findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(List.of(child.getId())))
                .thenReturn(List.of());

        // Act
        AnalyticsResponse<InventoryInsights> response = analyticsService.getInventoryInsights(null, user);

        // Assert
        assertTrue(response.isSuccess());
        assertEquals("No inventory items found", response.getMessage());
        verifyNoInteractions(usageLogRepository);
    }
}
