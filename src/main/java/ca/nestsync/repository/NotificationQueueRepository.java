package ca.nestsync.repository;

import ca.nestsync.entity.NotificationQueue;
import ca.nestsync.entity.NotificationQueue.NotificationChannel;
import ca.nestsync.entity.NotificationQueue.NotificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for queued notifications.
 */
@Repository
public interface NotificationQueueRepository extends JpaRepository<NotificationQueue, UUID> {

    List<NotificationQueue> findByUserIdAndStatusInOrderByScheduledForAsc(UUID userId, Collection<NotificationStatus> statuses);

    /**
     * Count entries of one channel created for a user since a point in time.
     * Every notification has exactly one IN_APP entry, so counting that channel
     * counts notifications; drives the daily limit.
     */
    long countByUserIdAndChannelAndCreatedAtGreaterThanEqual(UUID userId, NotificationChannel channel, LocalDateTime since);

    /**
     * Entries whose deferred delivery time has come.
     */
    List<NotificationQueue> findByStatusAndScheduledForLessThanEqual(NotificationStatus status, LocalDateTime now);
}
