package ca.nestsync.repository;

import ca.nestsync.entity.FamilyChildAccess;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface FamilyChildAccessRepository extends JpaRepository<FamilyChildAccess, UUID> {

    boolean existsByFamilyIdAndChildId(UUID familyId, UUID childId);

    List<FamilyChildAccess> findByFamilyId(UUID familyId);

    /**
     * Whether the user reaches the child through an active, unexpired membership
     * in any family it is shared with.
     *
     * @param now current UTC time; memberships whose access expired before it do not count
     */
    @Query("SELECT COUNT(a) > 0 FROM FamilyChildAccess a, FamilyMember m "
            + "WHERE a.childId = :childId AND m.familyId = a.familyId AND m.userId = :userId "
            + "AND m.status = ca.nestsync.entity.FamilyMember.MemberStatus.ACTIVE "
            + "AND (m.accessExpiresAt IS NULL OR m.accessExpiresAt > :now)")
    boolean isSharedWithUser(@Param("childId") UUID childId,
                             @Param("userId") UUID userId,
                             @Param("now") LocalDateTime now);
}
