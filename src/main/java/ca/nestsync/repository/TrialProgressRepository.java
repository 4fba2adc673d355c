package ca.nestsync.repository;

import ca.nestsync.entity.TrialProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TrialProgressRepository extends JpaRepository<TrialProgress, UUID> {

    Optional<TrialProgress> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);
}
