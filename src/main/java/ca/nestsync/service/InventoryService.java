package ca.nestsync.service;

import ca.nestsync.dto.request.CreateInventoryItemInput;
import ca.nestsync.dto.request.LogDiaperChangeInput;
import ca.nestsync.dto.request.UpdateInventoryItemInput;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.DashboardStats;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.InventoryItem;
import ca.nestsync.entity.UsageLog;
import ca.nestsync.entity.UsageLog.UsageType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.InventoryItemRepository;
import ca.nestsync.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Diaper inventory and usage tracking.
 *
 * Logging a diaper change takes one unit from the child's stock of the current
 * size, soonest-expiring pack first. The dashboard turns the remaining stock
 * and the daily usage into a days-remaining estimate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InventoryService {

    static final int MIN_LOGS_FOR_OBSERVED_USAGE = 14;
    static final Set<String> PRODUCT_TYPES = Set.of("diaper", "wipes", "cream", "other");
    private static final int MAX_PAGE_SIZE = 100;

    private final InventoryItemRepository inventoryItemRepository;
    private final UsageLogRepository usageLogRepository;
    private final ChildService childService;
    private final NotificationService notificationService;

    /**
     * Home screen figures for a child.
     *
     * dailyUsage is the profile value unless at least 14 changes were logged in
     * the last 7 days, in which case the higher of the two is used.
     */
    @Transactional(readOnly = true)
    public DashboardStats getDashboardStats(UUID childId, UserProfile user) {
        Child child = childService.requireAccessibleChild(childId, user);
        LocalDateTime now = now();

        int diapersLeft = (int) inventoryItemRepository.sumRemainingByChildAndType(childId, InventoryItem.TYPE_DIAPER);
        int todayChanges = (int) usageLogRepository.countByChildIdAndUsageTypeAndLoggedAtGreaterThanEqualAndIsDeletedFalse(
                childId, UsageType.DIAPER_CHANGE, now.toLocalDate().atStartOfDay());
        String lastChange = usageLogRepository
                .findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(childId, UsageType.DIAPER_CHANGE)
                .map(log -> formatTimeAgo(log.getLoggedAt(), now))
                .orElse(null);

        long weeklyLogged = usageLogRepository.countByChildIdAndUsageTypeAndLoggedAtGreaterThanEqualAndIsDeletedFalse(
                childId, UsageType.DIAPER_CHANGE, now.minusDays(7));
        int dailyUsage = computeDailyUsage(child.effectiveDailyUsage(), weeklyLogged);
        int daysRemaining = diapersLeft > 0 && dailyUsage > 0 ? diapersLeft / dailyUsage : 0;

        log.debug("Dashboard for child {}: left={}, daily={}, weeklyLogged={}", childId, diapersLeft, dailyUsage, weeklyLogged);
        return DashboardStats.builder()
                .diapersLeft(diapersLeft)
                .daysRemaining(daysRemaining)
                .lastChange(lastChange)
                .todayChanges(todayChanges)
                .currentSize(child.getCurrentDiaperSize() != null ? child.getCurrentDiaperSize().name() : null)
                .dailyUsage(dailyUsage)
                .build();
    }

    @Transactional(readOnly = true)
    public Connection<InventoryItem> getInventoryItems(UUID childId, UserProfile user, String productType,
                                                       int limit, int offset) {
        childService.requireAccessibleChild(childId, user);
        String type = productType != null ? normalizeProductType(productType) : null;
        int pageSize = clampLimit(limit);
        int start = Math.max(0, offset);

        List<InventoryItem> rows = inventoryItemRepository.findPage(childId, type, new OffsetPageRequest(start, pageSize + 1));
        boolean hasNext = rows.size() > pageSize;
        List<InventoryItem> page = rows.stream().limit(pageSize).toList();
        int total = (int) inventoryItemRepository.countActive(childId, type);

        return Connection.of(page, i -> Cursors.encode(Cursors.INVENTORY_ITEM, i.getId()), hasNext, start > 0, total);
    }

    @Transactional(readOnly = true)
    public Connection<UsageLog> getUsageLogs(UUID childId, UserProfile user, UsageType usageType,
                                             int daysBack, int limit, int offset) {
        childService.requireAccessibleChild(childId, user);
        if (daysBack < 1 || daysBack > 365) {
            throw new IllegalArgumentException("daysBack must be between 1 and 365");
        }
        LocalDateTime since = now().minusDays(daysBack);
        int pageSize = clampLimit(limit);
        int start = Math.max(0, offset);

        List<UsageLog> rows = usageLogRepository.findPage(childId, usageType, since, new OffsetPageRequest(start, pageSize + 1));
        boolean hasNext = rows.size() > pageSize;
        List<UsageLog> page = rows.stream().limit(pageSize).toList();
        int total = (int) usageLogRepository.countActive(childId, usageType, since);

        return Connection.of(page, l -> Cursors.encode(Cursors.USAGE_LOG, l.getId()), hasNext, start > 0, total);
    }

    /**
     * Log a change and take one diaper of the child's current size from stock.
     * When no matching stock exists the change is still logged.
     */
    @Transactional
    public UsageLog logDiaperChange(LogDiaperChangeInput input, UserProfile user) {
        Child child = childService.requireAccessibleChild(input.getChildId(), user);
        UsageType usageType = input.getUsageType() != null ? input.getUsageType() : UsageType.DIAPER_CHANGE;
        LocalDateTime loggedAt = input.getLoggedAt() != null ? parseDateTime(input.getLoggedAt()) : now();
        if (input.getProductRating() != null && (input.getProductRating() < 1 || input.getProductRating() > 5)) {
            throw new IllegalArgumentException("Product rating must be between 1 and 5");
        }

        UsageLog usageLog = new UsageLog();
        usageLog.setChildId(child.getId());
        usageLog.setLoggedBy(user.getId());
        usageLog.setUsageType(usageType);
        usageLog.setLoggedAt(loggedAt);
        usageLog.setQuantityUsed(1);
        usageLog.setWasWet(input.getWasWet());
        usageLog.setWasSoiled(input.getWasSoiled());
        usageLog.setHasLeakage(input.getHasLeakage());
        usageLog.setProductRating(input.getProductRating());
        usageLog.setNotes(input.getNotes());

        usageLogRepository.findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(child.getId(), usageType)
                .ifPresent(previous -> usageLog.setTimeSinceLastChange(
                        (int) Duration.between(previous.getLoggedAt(), loggedAt).toMinutes()));

        boolean consumed = false;
        if (usageType == UsageType.DIAPER_CHANGE) {
            Optional<InventoryItem> stock = inventoryItemRepository.findConsumable(
                    child.getId(), InventoryItem.TYPE_DIAPER, child.getCurrentDiaperSize().name(), PageRequest.of(0, 1))
                    .stream().findFirst();
            if (stock.isPresent()) {
                InventoryItem item = stock.get();
                item.consume(1, loggedAt.toLocalDate());
                inventoryItemRepository.save(item);
                usageLog.setInventoryItemId(item.getId());
                consumed = true;
            } else {
                log.info("No {} diapers in stock for child {}; change logged without inventory", child.getCurrentDiaperSize(), child.getId());
            }
        }

        UsageLog saved = usageLogRepository.save(usageLog);
        log.info("{} logged for child {} by user {}", usageType, child.getId(), user.getId());

        if (consumed) {
            long remaining = inventoryItemRepository.sumRemainingByChildAndType(child.getId(), InventoryItem.TYPE_DIAPER);
            notificationService.notifyLowStock(child, remaining + 1, remaining);
        }
        return saved;
    }

    @Transactional
    public InventoryItem createInventoryItem(CreateInventoryItemInput input, UserProfile user) {
        Child child = childService.requireAccessibleChild(input.getChildId(), user);
        if (input.getQuantityTotal() == null || input.getQuantityTotal() <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than 0");
        }
        validateCost(input.getCostCad());

        InventoryItem item = new InventoryItem();
        item.setChildId(child.getId());
        item.setCreatedBy(user.getId());
        item.setProductType(normalizeProductType(input.getProductType()));
        item.setBrand(input.getBrand().trim());
        item.setProductName(input.getProductName());
        item.setSize(input.getSize().trim());
        item.setQuantityTotal(input.getQuantityTotal());
        item.setQuantityRemaining(input.getQuantityTotal());
        item.setCostCad(input.getCostCad());
        item.setPurchaseDate(parseDate(input.getPurchaseDate(), "Purchase date"));
        item.setExpiryDate(parseDate(input.getExpiryDate(), "Expiry date"));
        item.setStorageLocation(input.getStorageLocation());
        item.setNotes(input.getNotes());

        InventoryItem saved = inventoryItemRepository.save(item);
        log.info("Inventory item {} ({} x{}) created for child {}", saved.getId(), saved.getBrand(),
                saved.getQuantityTotal(), child.getId());
        return saved;
    }

    @Transactional
    public InventoryItem updateInventoryItem(UUID itemId, UpdateInventoryItemInput input, UserProfile user) {
        InventoryItem item = requireAccessibleItem(itemId, user);

        if (input.getQuantityRemaining() != null) {
            if (input.getQuantityRemaining() < 0 || input.getQuantityRemaining() > item.getQuantityTotal()) {
                throw new IllegalArgumentException("Invalid quantity remaining");
            }
            item.setQuantityRemaining(input.getQuantityRemaining());
        }
        if (input.getQualityRating() != null) {
            if (input.getQualityRating() < 1 || input.getQualityRating() > 5) {
                throw new IllegalArgumentException("Quality rating must be between 1 and 5");
            }
            item.setQualityRating(input.getQualityRating());
        }
        if (input.getBrand() != null) {
            item.setBrand(input.getBrand().trim());
        }
        if (input.getProductName() != null) {
            item.setProductName(input.getProductName());
        }
        if (input.getSize() != null) {
            item.setSize(input.getSize().trim());
        }
        if (input.getCostCad() != null) {
            validateCost(input.getCostCad());
            item.setCostCad(input.getCostCad());
        }
        if (input.getExpiryDate() != null) {
            item.setExpiryDate(parseDate(input.getExpiryDate(), "Expiry date"));
        }
        if (input.getStorageLocation() != null) {
            item.setStorageLocation(input.getStorageLocation());
        }
        if (input.getIsOpened() != null) {
            item.setIsOpened(input.getIsOpened());
            if (input.getIsOpened() && item.getOpenedDate() == null) {
                item.setOpenedDate(now().toLocalDate());
            }
        }
        if (input.getNotes() != null) {
            item.setNotes(input.getNotes());
        }

        log.info("Inventory item {} updated by user {}", itemId, user.getId());
        return inventoryItemRepository.save(item);
    }

    /**
     * Soft-delete an item and its usage logs. The caller must type the exact
     * confirmation text {@code DELETE <brand> <size>}.
     */
    @Transactional
    public void deleteInventoryItem(UUID itemId, String confirmationText, UserProfile user) {
        InventoryItem item = inventoryItemRepository.findByIdAndIsDeletedFalse(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Inventory item not found or already deleted"));
        childService.requireAccessibleChild(item.getChildId(), user);

        String expected = item.deletionConfirmationText();
        if (!expected.equals(confirmationText)) {
            throw new IllegalArgumentException("Confirmation text must be exactly: " + expected);
        }

        LocalDateTime now = now();
        item.softDelete(now);
        inventoryItemRepository.save(item);
        int logs = usageLogRepository.softDeleteByInventoryItemId(itemId, now);
        log.info("Inventory item {} deleted by user {} ({} usage logs removed)", itemId, user.getId(), logs);
    }

    /**
     * "N day(s) ago", "N hour(s) ago", "N minute(s) ago" or "Just now".
     */
    static String formatTimeAgo(LocalDateTime then, LocalDateTime now) {
        Duration delta = Duration.between(then, now);
        long days = delta.toDays();
        if (days > 0) {
            return days + (days == 1 ? " day ago" : " days ago");
        }
        long hours = delta.toHours();
        if (hours > 0) {
            return hours + (hours == 1 ? " hour ago" : " hours ago");
        }
        long minutes = delta.toMinutes();
        if (minutes > 0) {
            return minutes + (minutes == 1 ? " minute ago" : " minutes ago");
        }
        return "Just now";
    }

    static int computeDailyUsage(int profileDailyUsage, long loggedLastSevenDays) {
        if (loggedLastSevenDays >= MIN_LOGS_FOR_OBSERVED_USAGE) {
            return (int) Math.max(profileDailyUsage, loggedLastSevenDays / 7);
        }
        return profileDailyUsage;
    }

    private InventoryItem requireAccessibleItem(UUID itemId, UserProfile user) {
        InventoryItem item = inventoryItemRepository.findByIdAndIsDeletedFalse(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Inventory item not found"));
        childService.requireAccessibleChild(item.getChildId(), user);
        return item;
    }

    private String normalizeProductType(String productType) {
        String normalized = productType.trim().toLowerCase(Locale.ROOT);
        if (!PRODUCT_TYPES.contains(normalized)) {
            throw new IllegalArgumentException("Product type must be one of " + PRODUCT_TYPES);
        }
        return normalized;
    }

    private void validateCost(BigDecimal cost) {
        if (cost != null && cost.signum() < 0) {
            throw new IllegalArgumentException("Cost cannot be negative");
        }
    }

    private LocalDate parseDate(String value, String label) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(label + " must be in yyyy-MM-dd format");
        }
    }

    private LocalDateTime parseDateTime(String value) {
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("loggedAt must be an ISO-8601 date-time");
            }
        }
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
