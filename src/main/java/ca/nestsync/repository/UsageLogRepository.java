package ca.nestsync.repository;

import ca.nestsync.entity.UsageLog;
import ca.nestsync.entity.UsageLog.UsageType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UsageLogRepository extends JpaRepository<UsageLog, UUID> {

    long countByChildIdAndUsageTypeAndLoggedAtGreaterThanEqualAndIsDeletedFalse(
            UUID childId, UsageType usageType, LocalDateTime since);

    Optional<UsageLog> findFirstByChildIdAndUsageTypeAndIsDeletedFalseOrderByLoggedAtDesc(
            UUID childId, UsageType usageType);

    @Query("SELECT u FROM UsageLog u WHERE u.childId = :childId AND u.isDeleted = false "
            + "AND u.loggedAt >= :since AND (:usageType IS NULL OR u.usageType = :usageType) "
            + "ORDER BY u.loggedAt DESC")
    List<UsageLog> findPage(@Param("childId") UUID childId,
                            @Param("usageType") UsageType usageType,
                            @Param("since") LocalDateTime since,
                            Pageable pageable);

    @Query("SELECT COUNT(u) FROM UsageLog u WHERE u.childId = :childId AND u.isDeleted = false "
            + "AND u.loggedAt >= :since AND (:usageType IS NULL OR u.usageType = :usageType)")
    long countActive(@Param("childId") UUID childId,
                     @Param("usageType") UsageType usageType,
                     @Param("since") LocalDateTime since);

    /**
     * Logs of several children in [from, to), oldest first, for the analytics.
     *
     * @param childIds children in scope; must not be empty
     * @param usageType one type, or null for all
     */
    @Query("SELECT u FROM UsageLog u WHERE u.childId IN :childIds AND u.isDeleted = false "
            + "AND u.loggedAt >= :from AND u.loggedAt < :to "
            + "AND (:usageType IS NULL OR u.usageType = :usageType) "
            + "ORDER BY u.loggedAt ASC, u.id ASC")
    List<UsageLog> findInRange(@Param("childIds") Collection<UUID> childIds,
                               @Param("usageType") UsageType usageType,
                               @Param("from") LocalDateTime from,
                               @Param("to") LocalDateTime to);

    /**
     * Soft-delete every log that consumed from an inventory item.
     *
     * @return number of rows updated
     */
    @Modifying
    @Query("UPDATE UsageLog u SET u.isDeleted = true, u.deletedAt = :now "
            + "WHERE u.inventoryItemId = :itemId AND u.isDeleted = false")
    int softDeleteByInventoryItemId(@Param("itemId") UUID itemId, @Param("now") LocalDateTime now);
}
