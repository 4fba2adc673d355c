package ca.nestsync.repository;

import ca.nestsync.entity.CaregiverInvitation;
import ca.nestsync.entity.CaregiverInvitation.InvitationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CaregiverInvitationRepository extends JpaRepository<CaregiverInvitation, UUID> {

    Optional<CaregiverInvitation> findByInvitationToken(String invitationToken);

    Optional<CaregiverInvitation> findFirstByFamilyIdAndEmailIgnoreCaseAndStatus(
            UUID familyId, String email, InvitationStatus status);

    List<CaregiverInvitation> findByFamilyIdAndStatusOrderByCreatedAtDesc(UUID familyId, InvitationStatus status);
}
