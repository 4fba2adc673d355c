package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.SignInInput;
import ca.nestsync.dto.request.SignUpInput;
import ca.nestsync.dto.response.AuthResponse;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.UserSession;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.SupabaseAuthException;
import ca.nestsync.repository.UserProfileRepository;
import ca.nestsync.security.JwtTokenProvider;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Account flows backed by Supabase Auth.
 *
 * Supabase owns credentials and sessions; this service keeps the local profile
 * and the PIPEDA consent records in step with it.
 *
 * 1. Sign up: consents checked, Supabase account created, local profile
 *    created in PENDING_VERIFICATION, sign-up consents recorded.
 * 2. Sign in: Supabase password grant, local profile found or created,
 *    last login recorded, session returned.
 * 3. Refresh / sign out / password reset: delegated to Supabase.
 *
 * @see ca.nestsync.service.SupabaseAuthClient
 * @see ca.nestsync.service.ConsentService
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    private final SupabaseAuthClient supabaseAuthClient;
    private final UserProfileRepository userProfileRepository;
    private final UserService userService;
    private final ConsentService consentService;
    private final JwtTokenProvider jwtTokenProvider;
    private final AppSettings appSettings;

    @Transactional
    public AuthResponse signUp(SignUpInput input) {
        if (!input.isAcceptPrivacyPolicy() || !input.isAcceptTermsOfService()) {
            log.warn("Sign-up rejected: required consents not accepted");
            return AuthResponse.failure("Privacy policy and terms of service must be accepted");
        }

        String email = input.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userProfileRepository.existsByEmailIgnoreCaseAndIsDeletedFalse(email)) {
            return AuthResponse.failure("An account with this email already exists");
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("first_name", input.getFirstName());
        metadata.put("last_name", input.getLastName());
        metadata.put("timezone", input.getTimezone() != null ? input.getTimezone() : appSettings.getDefaultTimezone());
        metadata.put("language", input.getLanguage() != null ? input.getLanguage() : "en");
        metadata.put("province", input.getProvince());

        SupabaseAuthClient.AuthResult result;
        try {
            result = supabaseAuthClient.signUp(email, input.getPassword(), metadata);
        } catch (SupabaseAuthException ex) {
            return AuthResponse.failure(ex.isClientError() ? ex.getMessage() : "Sign up failed. Please try again.");
        }

        UserProfile profile = new UserProfile(result.user().id(), email);
        profile.setFirstName(input.getFirstName());
        profile.setLastName(input.getLastName());
        profile.setTimezone(input.getTimezone() != null
                ? userService.validateTimezone(input.getTimezone())
                : appSettings.getDefaultTimezone());
        if (input.getLanguage() != null) {
            profile.setLanguage(userService.validateLanguage(input.getLanguage()));
        }
        if (input.getProvince() != null) {
            profile.setProvince(userService.validateProvince(input.getProvince()));
        }
        profile.setCurrency(appSettings.getCurrency());
        profile.setPrivacyPolicyAccepted(true);
        profile.setTermsOfServiceAccepted(true);
        profile.setMarketingConsent(input.isMarketingConsent());
        profile.setAnalyticsConsent(input.isAnalyticsConsent());
        profile.setConsentVersion(appSettings.getConsentVersion());
        profile.setEmailVerified(result.user().emailConfirmed());
        if (result.user().emailConfirmed()) {
            profile.setStatus(UserProfile.UserStatus.ACTIVE);
        }
        UserProfile saved = userProfileRepository.save(profile);

        consentService.recordSignUpConsents(saved, input.isMarketingConsent(), input.isAnalyticsConsent());

        log.info("Account created for user {} (email verified: {})", saved.getId(), saved.getEmailVerified());
        return AuthResponse.builder()
                .success(true)
                .message("Account created successfully. Please check your email for verification.")
                .user(saved)
                .session(toSession(result.session()))
                .build();
    }

    @Transactional
    public AuthResponse signIn(SignInInput input) {
        String email = input.getEmail().trim().toLowerCase(Locale.ROOT);
        SupabaseAuthClient.AuthResult result;
        try {
            result = supabaseAuthClient.signInWithPassword(email, input.getPassword());
        } catch (SupabaseAuthException ex) {
            log.warn("Sign-in failed for {}: {}", email, ex.getMessage());
            return AuthResponse.failure(ex.isClientError()
                    ? "Invalid email or password"
                    : "Sign in failed. Please try again.");
        }

        UserProfile profile = userService.findOrCreate(result.user().id(), email, result.user().emailConfirmed());
        profile = userService.recordLogin(profile);

        log.info("User {} signed in", profile.getId());
        return AuthResponse.builder()
                .success(true)
                .message("Signed in successfully")
                .user(profile)
                .session(toSession(result.session()))
                .build();
    }

    @Transactional
    public AuthResponse refreshToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return AuthResponse.failure("Refresh token is required");
        }
        try {
            SupabaseAuthClient.AuthResult result = supabaseAuthClient.refresh(refreshToken);
            UserProfile profile = userService.findOrCreate(
                    result.user().id(), result.user().email(), result.user().emailConfirmed());
            return AuthResponse.builder()
                    .success(true)
                    .message("Token refreshed")
                    .user(profile)
                    .session(toSession(result.session()))
                    .build();
        } catch (SupabaseAuthException ex) {
            return AuthResponse.failure("Session expired. Please sign in again.");
        }
    }

    public MutationResponse signOut() {
        String token = currentAccessToken();
        if (token == null) {
            return MutationResponse.failure("Not signed in");
        }
        try {
            supabaseAuthClient.signOut(token);
        } catch (SupabaseAuthException ex) {
            // The client drops its tokens either way.
            log.warn("Supabase sign-out failed: {}", ex.getMessage());
        }
        return MutationResponse.ok("Signed out successfully");
    }

    /**
     * Always answers success so the response does not reveal whether an account exists.
     */
    public MutationResponse resetPassword(String email) {
        if (email != null && !email.isBlank()) {
            try {
                supabaseAuthClient.sendPasswordReset(email.trim().toLowerCase(Locale.ROOT));
            } catch (SupabaseAuthException ex) {
                log.warn("Password reset request failed: {}", ex.getMessage());
            }
        }
        return MutationResponse.ok("If an account exists for this email, a password reset link has been sent.");
    }

    private String currentAccessToken() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            HttpServletRequest request = ((ServletRequestAttributes) attributes).getRequest();
            return jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));
        }
        return null;
    }

    private UserSession toSession(SupabaseAuthClient.Session session) {
        if (session == null) {
            return null;
        }
        return UserSession.builder()
                .accessToken(session.accessToken())
                .refreshToken(session.refreshToken())
                .expiresIn(session.expiresIn())
                .tokenType(session.tokenType())
                .build();
    }
}
