package ca.nestsync.repository;

import ca.nestsync.entity.FamilyMember;
import ca.nestsync.entity.FamilyMember.MemberRole;
import ca.nestsync.entity.FamilyMember.MemberStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FamilyMemberRepository extends JpaRepository<FamilyMember, UUID> {

    Optional<FamilyMember> findByFamilyIdAndUserId(UUID familyId, UUID userId);

    Optional<FamilyMember> findByIdAndFamilyId(UUID id, UUID familyId);

    List<FamilyMember> findByFamilyIdAndStatus(UUID familyId, MemberStatus status);

    long countByFamilyIdAndRoleAndStatus(UUID familyId, MemberRole role, MemberStatus status);

    boolean existsByFamilyIdAndUserIdAndStatus(UUID familyId, UUID userId, MemberStatus status);
}
