package ca.nestsync.repository;

import ca.nestsync.entity.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for UserProfile entity operations.
 *
 * Profiles are looked up by the Supabase user id carried in the JWT {@code sub}
 * claim; the local primary key is used for every foreign key in the schema.
 */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    /**
     * Find the non-deleted profile of an authenticated Supabase user.
     *
     * @param supabaseUserId the {@code sub} claim of the access token
     * @return Optional containing the profile if present
     */
    Optional<UserProfile> findBySupabaseUserIdAndIsDeletedFalse(UUID supabaseUserId);

    Optional<UserProfile> findByEmailIgnoreCaseAndIsDeletedFalse(String email);

    boolean existsByEmailIgnoreCaseAndIsDeletedFalse(String email);
}
