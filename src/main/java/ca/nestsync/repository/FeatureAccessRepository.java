package ca.nestsync.repository;

import ca.nestsync.entity.FeatureAccess;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FeatureAccessRepository extends JpaRepository<FeatureAccess, UUID> {

    List<FeatureAccess> findByUserIdOrderByFeatureIdAsc(UUID userId);

    Optional<FeatureAccess> findByUserIdAndFeatureId(UUID userId, String featureId);

    @Modifying
    @Query("DELETE FROM FeatureAccess f WHERE f.userId = :userId")
    int deleteAllForUser(@Param("userId") UUID userId);
}
