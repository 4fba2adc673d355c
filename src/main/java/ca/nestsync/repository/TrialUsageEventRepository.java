package ca.nestsync.repository;

import ca.nestsync.entity.TrialUsageEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TrialUsageEventRepository extends JpaRepository<TrialUsageEvent, UUID> {

    long countByTrialProgressId(UUID trialProgressId);
}
