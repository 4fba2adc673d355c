package ca.nestsync.service;

import ca.nestsync.dto.request.CreateInventoryItemInput;
import ca.nestsync.dto.request.LogDiaperChangeInput;
import ca.nestsync.dto.request.UpdateInventoryItemInput;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.DashboardStats;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.Child.DiaperSize;
import ca.nestsync.entity.InventoryItem;
import ca.nestsync.entity.UsageLog;
import ca.nestsync.entity.UsageLog.UsageType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.InventoryItemRepository;
import ca.nestsync.repository.UsageLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InventoryService.
 *
 * Tests the core inventory flows:
 * - Dashboard figures and the observed-usage rule
 * - Logging a change against the soonest-expiring stock
 * - Item creation, partial updates and confirmed deletion
 *
 * @see ca.nestsync.service.InventoryService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("InventoryService Unit Tests")
class InventoryServiceTest {

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    @Mock
    private UsageLogRepository usageLogRepository;

    @Mock
    private ChildService childService;

    @Mock
    private NotificationService notificationService;

    @InjectMocks
    private InventoryService inventoryService;

    private UserProfile user;
    private Child child;

    @BeforeEach
    void setUp() {
        user = new UserProfile();
        user.setId(UUID.randomUUID());

        child = new Child();
        child.setId(UUID.randomUUID());
        child.setParentId(user.getId());
        child.setName("Emma");
        child.setCurrentDiaperSize(DiaperSize.SIZE_2);
        child.setDailyUsageCount(8);
    }

    private InventoryItem diaperPack(int total, int remaining) {
        InventoryItem item = new InventoryItem();
        item.setId(UUID.randomUUID());
        item.setChildId(child.getId());
        item.setProductType(InventoryItem.TYPE_DIAPER);
        item.setBrand("Huggies");
        item.setSize("SIZE_2");
        item.setQuantityTotal(total);
        item.setQuantityRemaining(remaining);
        return item;
    }

    @Test
    @DisplayName("Dashboard divides stock by the profile usage when few changes were logged")
    void testDashboardStatsWithProfileUsage() {
        // Arrange
        UsageLog last = new UsageLog();
        last.setLoggedAt(LocalDateTime.now(ZoneOffset.UTC).minusHours(2).minusMinutes(5));
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(inventoryItemRepository.sumRemainingByChildAndType(child.getId(), InventoryItem.TYPE_DIAPER)).thenReturn(42L);
        when(usageLogRepository.countByChildIdAndUsageTypeAndLoggedAtGreaterThanEqualAndIsDeletedFalse(
                eq(child.getId()), eq(UsageType.DIAPER_CHANGE), any(LocalDateTime.class)))
                .thenReturn(4L, 10L);
        when(usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
                child.getId(), UsageType.DIAPER_CHANGE)).thenReturn(Optional.of(last));

        // Act
        DashboardStats stats = inventoryService.getDashboardStats(child.getId(), user);

        // Assert
        assertEquals(42, stats.getDiapersLeft());
        assertEquals(8, stats.getDailyUsage());
        assertEquals(5, stats.getDaysRemaining());
        assertEquals(4, stats.getTodayChanges());
        assertEquals("2 hours ago", stats.getLastChange());
        assertEquals("SIZE_2", stats.getCurrentSize());
    }

    @Test
    @DisplayName("Dashboard with empty stock and no history")
    void testDashboardStatsEmpty() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(inventoryItemRepository.sumRemainingByChildAndType(child.getId(), InventoryItem.TYPE_DIAPER)).thenReturn(0L);
        when(usageLogRepository.countByChildIdAndUsageTypeAndLoggedAtGreaterThanEqualAndIsDeletedFalse(
                eq(child.getId()), eq(UsageType.DIAPER_CHANGE), any(LocalDateTime.class)))
                .thenReturn(0L);
        when(usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
                child.getId(), UsageType.DIAPER_CHANGE)).thenReturn(Optional.empty());

        // Act
        DashboardStats stats = inventoryService.getDashboardStats(child.getId(), user);

        // Assert
        assertEquals(0, stats.getDiapersLeft());
        assertEquals(0, stats.getDaysRemaining());
        assertNull(stats.getLastChange());
    }

    @Test
    @DisplayName("Observed usage replaces the profile value only when higher and well sampled")
    void testComputeDailyUsage() {
        assertEquals(8, InventoryService.computeDailyUsage(8, 13));
        assertEquals(10, InventoryService.computeDailyUsage(8, 70));
        assertEquals(8, InventoryService.computeDailyUsage(8, 21));
    }

    @Test
    @DisplayName("Time-ago text picks the largest whole unit")
    void testFormatTimeAgo() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 10, 12, 0);
        assertEquals("1 day ago", InventoryService.formatTimeAgo(now.minusHours(30), now));
        assertEquals("3 days ago", InventoryService.formatTimeAgo(now.minusDays(3), now));
        assertEquals("1 hour ago", InventoryService.formatTimeAgo(now.minusMinutes(61), now));
        assertEquals("5 minutes ago", InventoryService.formatTimeAgo(now.minusMinutes(5), now));
        assertEquals("Just now", InventoryService.formatTimeAgo(now.minusSeconds(20), now));
    }

    @Test
    @DisplayName("Logging a change consumes one diaper and checks the stock level")
    void testLogDiaperChangeConsumesStock() {
        // Arrange
        InventoryItem pack = diaperPack(30, 12);
        UsageLog previous = new UsageLog();
        previous.setLoggedAt(LocalDateTime.of(2024, 5, 10, 9, 0));

        LogDiaperChangeInput input = new LogDiaperChangeInput();
        input.setChildId(child.getId());
        input.setLoggedAt("2024-05-10T11:30:00Z");
        input.setWasWet(true);

        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
                child.getId(), UsageType.DIAPER_CHANGE)).thenReturn(Optional.of(previous));
        when(inventoryItemRepository.findConsumable(eq(child.getId()), eq(InventoryItem.TYPE_DIAPER), eq("SIZE_2"),
                any(Pageable.class))).thenReturn(List.of(pack));
        when(usageLogRepository.save(any(UsageLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(inventoryItemRepository.sumRemainingByChildAndType(child.getId(), InventoryItem.TYPE_DIAPER)).thenReturn(11L);

        // Act
        UsageLog saved = inventoryService.logDiaperChange(input, user);

        // Assert
        assertEquals(11, pack.getQuantityRemaining());
        assertTrue(pack.getIsOpened());
        assertEquals(LocalDate.of(2024, 5, 10), pack.getOpenedDate());
        assertEquals(pack.getId(), saved.getInventoryItemId());
        assertEquals(150, saved.getTimeSinceLastChange());
        assertEquals(LocalDateTime.of(2024, 5, 10, 11, 30), saved.getLoggedAt());
        verify(inventoryItemRepository).save(pack);
        verify(notificationService).notifyLowStock(child, 12L, 11L);
    }

    @Test
    @DisplayName("A change without matching stock is still logged")
    void testLogDiaperChangeWithoutStock() {
        // Arrange
        LogDiaperChangeInput input = new LogDiaperChangeInput();
        input.setChildId(child.getId());

        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
                child.getId(), UsageType.DIAPER_CHANGE)).thenReturn(Optional.empty());
        when(inventoryItemRepository.findConsumable(any(), any(), any(), any(Pageable.class))).thenReturn(List.of());
        when(usageLogRepository.save(any(UsageLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        UsageLog saved = inventoryService.logDiaperChange(input, user);

        // Assert
        assertNull(saved.getInventoryItemId());
        assertNull(saved.getTimeSinceLastChange());
        verify(inventoryItemRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Wipe use does not touch diaper stock")
    void testLogWipeUse() {
        // Arrange
        LogDiaperChangeInput input = new LogDiaperChangeInput();
        input.setChildId(child.getId());
        input.setUsageType(UsageType.WIPE_USE);

        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
                child.getId(), UsageType.WIPE_USE)).thenReturn(Optional.empty());
        when(usageLogRepository.save(any(UsageLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        UsageLog saved = inventoryService.logDiaperChange(input, user);

        // Assert
        assertEquals(UsageType.WIPE_USE, saved.getUsageType());
        verify(inventoryItemRepository, never()).findConsumable(any(), any(), any(), any());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Invalid rating and timestamp are rejected")
    void testLogDiaperChangeValidation() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        LogDiaperChangeInput badRating = new LogDiaperChangeInput();
        badRating.setChildId(child.getId());
        badRating.setProductRating(6);
        LogDiaperChangeInput badTime = new LogDiaperChangeInput();
        badTime.setChildId(child.getId());
        badTime.setLoggedAt("yesterday");

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> inventoryService.logDiaperChange(badRating, user));
        assertThrows(IllegalArgumentException.class, () -> inventoryService.logDiaperChange(badTime, user));
        verify(usageLogRepository, never()).save(any());
    }

    @Test
    @DisplayName("Creating an item starts it full and normalizes the product type")
    void testCreateInventoryItem() {
        // Arrange
        CreateInventoryItemInput input = new CreateInventoryItemInput();
        input.setChildId(child.getId());
        input.setProductType(" Diaper ");
        input.setBrand(" Pampers ");
        input.setSize("SIZE_2");
        input.setQuantityTotal(84);
        input.setCostCad(new BigDecimal("39.99"));
        input.setExpiryDate("2026-01-31");

        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(inventoryItemRepository.save(any(InventoryItem.class))).thenAnswer(invocation -> {
            InventoryItem item = invocation.getArgument(0);
            item.setId(UUID.randomUUID());
            return item;
        });

        // Act
        InventoryItem item = inventoryService.createInventoryItem(input, user);

        // Assert
        assertEquals("diaper", item.getProductType());
        assertEquals("Pampers", item.getBrand());
        assertEquals(84, item.getQuantityRemaining());
        assertEquals(LocalDate.of(2026, 1, 31), item.getExpiryDate());
        assertEquals(user.getId(), item.getCreatedBy());
    }

    @Test
    @DisplayName("Creating an item rejects zero quantity, negative cost and unknown types")
    void testCreateInventoryItemValidation() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        CreateInventoryItemInput input = new CreateInventoryItemInput();
        input.setChildId(child.getId());
        input.setProductType("diaper");
        input.setBrand("Pampers");
        input.setSize("SIZE_2");
        input.setQuantityTotal(0);

        // Act & Assert
        IllegalArgumentException zero = assertThrows(IllegalArgumentException.class,
                () -> inventoryService.createInventoryItem(input, user));
        assertEquals("Quantity must be greater than 0", zero.getMessage());

        input.setQuantityTotal(10);
        input.setCostCad(new BigDecimal("-1"));
        assertThrows(IllegalArgumentException.class, () -> inventoryService.createInventoryItem(input, user));

        input.setCostCad(null);
        input.setProductType("formula");
        assertThrows(IllegalArgumentException.class, () -> inventoryService.createInventoryItem(input, user));
        verify(inventoryItemRepository, never()).save(any());
    }

    @Test
    @DisplayName("Update keeps remaining quantity within the pack size")
    void testUpdateInventoryItem() {
        // Arrange
        InventoryItem pack = diaperPack(30, 20);
        when(inventoryItemRepository.findByIdAndIsDeletedFalse(pack.getId())).thenReturn(Optional.of(pack));
        when(inventoryItemRepository.save(any(InventoryItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UpdateInventoryItemInput tooMany = new UpdateInventoryItemInput();
        tooMany.setQuantityRemaining(31);
        UpdateInventoryItemInput valid = new UpdateInventoryItemInput();
        valid.setQuantityRemaining(5);
        valid.setIsOpened(true);
        valid.setQualityRating(4);

        // Act
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> inventoryService.updateInventoryItem(pack.getId(), tooMany, user));
        InventoryItem updated = inventoryService.updateInventoryItem(pack.getId(), valid, user);

        // Assert
        assertEquals("Invalid quantity remaining", ex.getMessage());
        assertEquals(5, updated.getQuantityRemaining());
        assertEquals(4, updated.getQualityRating());
        assertNotNull(updated.getOpenedDate());
        verify(childService, times(2)).requireAccessibleChild(child.getId(), user);
    }

    @Test
    @DisplayName("Deletion requires the exact confirmation text and removes the usage logs")
    void testDeleteInventoryItem() {
        // Arrange
        InventoryItem pack = diaperPack(30, 20);
        when(inventoryItemRepository.findByIdAndIsDeletedFalse(pack.getId())).thenReturn(Optional.of(pack));
        when(usageLogRepository.softDeleteByInventoryItemId(eq(pack.getId()), any(LocalDateTime.class))).thenReturn(3);

        // Act
        IllegalArgumentException wrong = assertThrows(IllegalArgumentException.class,
                () -> inventoryService.deleteInventoryItem(pack.getId(), "delete huggies size_2", user));
        inventoryService.deleteInventoryItem(pack.getId(), "DELETE Huggies SIZE_2", user);

        // Assert
        assertEquals("Confirmation text must be exactly: DELETE Huggies SIZE_2", wrong.getMessage());
        assertTrue(pack.getIsDeleted());
        assertNotNull(pack.getDeletedAt());
        verify(inventoryItemRepository, times(1)).save(pack);
    }

    @Test
    @DisplayName("Deleting a missing item fails")
    void testDeleteMissingItem() {
        // Arrange
        UUID itemId = UUID.randomUUID();
        when(inventoryItemRepository.findByIdAndIsDeletedFalse(itemId)).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class,
                () -> inventoryService.deleteInventoryItem(itemId, "DELETE x y", user));
    }

    @Test
    @DisplayName("Inventory page reports a next page from the look-ahead row")
    void testGetInventoryItemsPaging() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);
        when(inventoryItemRepository.findPage(eq(child.getId()), eq("diaper"), any(Pageable.class)))
                .thenReturn(List.of(diaperPack(30, 30), diaperPack(30, 10), diaperPack(30, 5)));
        when(inventoryItemRepository.countActive(child.getId(), "diaper")).thenReturn(7L);

        // Act
        Connection<InventoryItem> page = inventoryService.getInventoryItems(child.getId(), user, "DIAPER", 2, 0);

        // Assert
        assertEquals(2, page.getEdges().size());
        assertTrue(page.getPageInfo().isHasNextPage());
        assertFalse(page.getPageInfo().isHasPreviousPage());
        assertEquals(7, page.getPageInfo().getTotalCount());
        assertEquals(page.getEdges().get(1).getCursor(), page.getPageInfo().getEndCursor());
    }

    @Test
    @DisplayName("Usage history rejects a window outside one year")
    void testGetUsageLogsDaysBack() {
        // Arrange
        when(childService.requireAccessibleChild(child.getId(), user)).thenReturn(child);

        // Act & Assert
        assertThrows(IllegalArgumentException.class,
                () -> inventoryService.getUsageLogs(child.getId(), user, null, 0, 20, 0));
        assertThrows(IllegalArgumentException.class,
                () -> inventoryService.getUsageLogs(child.getId(), user, null, 366, 20, 0));
    }
}
