package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.UpdateProfileInput;
import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.entity.UserProfile.UserStatus;
import ca.nestsync.exception.UnauthorizedException;
import ca.nestsync.repository.UserProfileRepository;
import ca.nestsync.security.CurrentUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves and maintains the local profile behind a Supabase identity.
 *
 * A profile is created lazily the first time an authenticated caller touches
 * the API, using the {@code sub} and {@code email} claims of the token.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserService {

    private static final Set<String> LANGUAGES = Set.of("en", "fr");

    private final UserProfileRepository userProfileRepository;
    private final AppSettings appSettings;

    /**
     * @return the caller's profile, created on first use
     * @throws UnauthorizedException if the request is anonymous
     */
    @Transactional
    public UserProfile requireCurrentUser() {
        UUID supabaseUserId = CurrentUser.requireSupabaseUserId();
        return userProfileRepository.findBySupabaseUserIdAndIsDeletedFalse(supabaseUserId)
                .orElseGet(() -> createFromToken(supabaseUserId, CurrentUser.email()));
    }

    /**
     * @return the caller's profile, or empty for anonymous requests
     */
    @Transactional
    public Optional<UserProfile> findCurrentUser() {
        if (CurrentUser.supabaseUserId().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(requireCurrentUser());
    }

    /**
     * Find or create the profile of a Supabase user, e.g. after sign-in.
     */
    @Transactional
    public UserProfile findOrCreate(UUID supabaseUserId, String email, boolean emailVerified) {
        UserProfile profile = userProfileRepository.findBySupabaseUserIdAndIsDeletedFalse(supabaseUserId)
                .orElseGet(() -> createFromToken(supabaseUserId, email));
        if (emailVerified && !Boolean.TRUE.equals(profile.getEmailVerified())) {
            profile.setEmailVerified(true);
            if (profile.getStatus() == UserStatus.PENDING_VERIFICATION) {
                profile.setStatus(UserStatus.ACTIVE);
            }
        }
        return profile;
    }

    @Transactional
    public UserProfile recordLogin(UserProfile profile) {
        profile.setLastLoginAt(LocalDateTime.now(ZoneOffset.UTC));
        return userProfileRepository.save(profile);
    }

    @Transactional
    public UserProfile updateProfile(UpdateProfileInput input) {
        UserProfile profile = requireCurrentUser();

        if (input.getFirstName() != null) {
            profile.setFirstName(input.getFirstName().trim());
        }
        if (input.getLastName() != null) {
            profile.setLastName(input.getLastName().trim());
        }
        if (input.getDisplayName() != null) {
            profile.setDisplayName(input.getDisplayName().trim());
        }
        if (input.getTimezone() != null) {
            profile.setTimezone(validateTimezone(input.getTimezone()));
        }
        if (input.getLanguage() != null) {
            profile.setLanguage(validateLanguage(input.getLanguage()));
        }
        if (input.getProvince() != null) {
            profile.setProvince(validateProvince(input.getProvince()));
        }

        log.info("Profile updated for user {}", profile.getId());
        return userProfileRepository.save(profile);
    }

    @Transactional
    public UserProfile completeOnboarding() {
        UserProfile profile = requireCurrentUser();
        if (!Boolean.TRUE.equals(profile.getOnboardingCompleted())) {
            profile.setOnboardingCompleted(true);
            profile.setOnboardingCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
            log.info("Onboarding completed for user {}", profile.getId());
        }
        return userProfileRepository.save(profile);
    }

    /**
     * Flag the account for deletion. Data is purged by the retention job after
     * the configured retention period.
     */
    @Transactional
    public UserProfile requestAccountDeletion() {
        UserProfile profile = requireCurrentUser();
        profile.setStatus(UserStatus.PENDING_DELETION);
        profile.setDeletionRequestedAt(LocalDateTime.now(ZoneOffset.UTC));
        log.info("Account deletion requested for user {} (retention {} days)",
                profile.getId(), appSettings.getDataRetentionDays());
        return userProfileRepository.save(profile);
    }

    String validateTimezone(String timezone) {
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone);
        }
    }

    String validateLanguage(String language) {
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        if (!LANGUAGES.contains(normalized)) {
            throw new IllegalArgumentException("Language must be one of " + LANGUAGES);
        }
        return normalized;
    }

    String validateProvince(String province) {
        try {
            return CanadianTaxRate.Province.valueOf(province.trim().toUpperCase(Locale.ROOT)).name();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid Canadian province code: " + province);
        }
    }

    private UserProfile createFromToken(UUID supabaseUserId, String email) {
        if (email == null || email.isBlank()) {
            throw UnauthorizedException.authenticationRequired();
        }
        UserProfile profile = new UserProfile(supabaseUserId, email.trim().toLowerCase(Locale.ROOT));
        profile.setTimezone(appSettings.getDefaultTimezone());
        profile.setCurrency(appSettings.getCurrency());
        profile.setConsentVersion(appSettings.getConsentVersion());
        log.info("Creating local profile for Supabase user {}", supabaseUserId);
        return userProfileRepository.save(profile);
    }
}
