package ca.nestsync.repository;

import ca.nestsync.entity.ConsentAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConsentAuditLogRepository extends JpaRepository<ConsentAuditLog, UUID> {

    List<ConsentAuditLog> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
