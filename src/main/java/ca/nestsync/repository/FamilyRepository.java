package ca.nestsync.repository;

import ca.nestsync.entity.Family;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FamilyRepository extends JpaRepository<Family, UUID> {

    Optional<Family> findByIdAndIsDeletedFalse(UUID id);

    /**
     * Families in which the user holds an ACTIVE membership.
     */
    @Query("SELECT f FROM Family f WHERE f.isDeleted = false AND f.id IN ("
            + "SELECT m.familyId FROM FamilyMember m WHERE m.userId = :userId "
            + "AND m.status = ca.nestsync.entity.FamilyMember.MemberStatus.ACTIVE) ORDER BY f.createdAt ASC")
    List<Family> findActiveForUser(@Param("userId") UUID userId);
}
