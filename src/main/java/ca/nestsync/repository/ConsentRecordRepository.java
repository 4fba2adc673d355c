package ca.nestsync.repository;

import ca.nestsync.entity.ConsentRecord;
import ca.nestsync.entity.ConsentRecord.ConsentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConsentRecordRepository extends JpaRepository<ConsentRecord, UUID> {

    List<ConsentRecord> findByUserIdOrderByConsentTypeAsc(UUID userId);

    Optional<ConsentRecord> findByUserIdAndConsentType(UUID userId, ConsentType consentType);
}
