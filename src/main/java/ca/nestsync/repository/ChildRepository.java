package ca.nestsync.repository;

import ca.nestsync.entity.Child;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for Child entity operations.
 *
 * Every finder excludes soft-deleted children.
 */
@Repository
public interface ChildRepository extends JpaRepository<Child, UUID> {

    Optional<Child> findByIdAndIsDeletedFalse(UUID id);

    Optional<Child> findByIdAndParentIdAndIsDeletedFalse(UUID id, UUID parentId);

    long countByParentIdAndIsDeletedFalse(UUID parentId);

    boolean existsByParentIdAndNameIgnoreCaseAndDateOfBirthAndIsDeletedFalse(UUID parentId, String name, LocalDate dateOfBirth);

    List<Child> findByParentIdAndIsDeletedFalseOrderByCreatedAtAsc(UUID parentId);

    /**
     * Keyset page of a parent's children ordered by creation time, then id.
     *
     * @param parentId owning user
     * @param afterCreatedAt createdAt of the last child on the previous page
     * @param afterId id of the last child on the previous page; breaks createdAt ties
     * @param pageable page size (callers ask for one extra row to detect a next page)
     * @return children after ({@code afterCreatedAt}, {@code afterId}) in that order
     */
    @Query("SELECT c FROM Child c WHERE c.parentId = :parentId AND c.isDeleted = false "
            + "AND (c.createdAt > :afterCreatedAt OR (c.createdAt = :afterCreatedAt AND c.id > :afterId)) "
            + "ORDER BY c.createdAt ASC, c.id ASC")
    List<Child> findPageAfter(@Param("parentId") UUID parentId,
                              @Param("afterCreatedAt") LocalDateTime afterCreatedAt,
                              @Param("afterId") UUID afterId,
                              Pageable pageable);
}
