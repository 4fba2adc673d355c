package ca.nestsync.repository;

import ca.nestsync.entity.InventoryItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for InventoryItem entity operations.
 */
@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, UUID> {

    Optional<InventoryItem> findByIdAndIsDeletedFalse(UUID id);

    List<InventoryItem> findByChildIdInAndIsDeletedFalseOrderByCreatedAtAsc(Collection<UUID> childIds);

    /**
     * Total diapers (or other product) left for a child across non-deleted items.
     *
     * @param childId the child
     * @param productType product type, e.g. "diaper"
     * @return sum of quantityRemaining, 0 when there are no items
     */
    @Query("SELECT COALESCE(SUM(i.quantityRemaining), 0) FROM InventoryItem i "
            + "WHERE i.childId = :childId AND i.productType = :productType AND i.isDeleted = false")
    long sumRemainingByChildAndType(@Param("childId") UUID childId, @Param("productType") String productType);

    /**
     * Stock to decrement for a diaper change: the matching size with units left,
     * soonest expiry first, then oldest.
     */
    @Query("SELECT i FROM InventoryItem i WHERE i.childId = :childId AND i.productType = :productType "
            + "AND i.size = :size AND i.quantityRemaining > 0 AND i.isDeleted = false "
            + "ORDER BY i.expiryDate ASC NULLS LAST, i.createdAt ASC")
    List<InventoryItem> findConsumable(@Param("childId") UUID childId,
                                       @Param("productType") String productType,
                                       @Param("size") String size,
                                       Pageable pageable);

    @Query("SELECT i FROM InventoryItem i WHERE i.childId = :childId AND i.isDeleted = false "
            + "AND (:productType IS NULL OR i.productType = :productType) ORDER BY i.createdAt DESC")
    List<InventoryItem> findPage(@Param("childId") UUID childId,
                                 @Param("productType") String productType,
                                 Pageable pageable);

    @Query("SELECT COUNT(i) FROM InventoryItem i WHERE i.childId = :childId AND i.isDeleted = false "
            + "AND (:productType IS NULL OR i.productType = :productType)")
    long countActive(@Param("childId") UUID childId, @Param("productType") String productType);
}
