package ca.nestsync.repository;

import ca.nestsync.entity.CaregiverPresence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CaregiverPresenceRepository extends JpaRepository<CaregiverPresence, UUID> {

    Optional<CaregiverPresence> findByFamilyIdAndUserId(UUID familyId, UUID userId);

    List<CaregiverPresence> findByFamilyIdOrderByLastSeenAtDesc(UUID familyId);
}
