package ca.nestsync.graphql;

import ca.nestsync.dto.request.SignInInput;
import ca.nestsync.dto.request.SignUpInput;
import ca.nestsync.dto.request.UpdateConsentInput;
import ca.nestsync.dto.request.UpdateProfileInput;
import ca.nestsync.dto.response.AuthResponse;
import ca.nestsync.dto.response.ConsentResponse;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.UserProfileResponse;
import ca.nestsync.entity.ConsentRecord;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.AuthService;
import ca.nestsync.service.ConsentService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

/**
 * Sign-up, sign-in, profile and PIPEDA consent operations.
 */
@Controller
@RequiredArgsConstructor
public class UserGraphQlController {

    private final AuthService authService;
    private final UserService userService;
    private final ConsentService consentService;

    @QueryMapping
    public UserProfile me() {
        return userService.findCurrentUser().orElse(null);
    }

    @QueryMapping
    public List<ConsentRecord> myConsents() {
        return consentService.getConsents(userService.requireCurrentUser());
    }

    @MutationMapping
    public AuthResponse signUp(@Argument @Valid SignUpInput input) {
        return authService.signUp(input);
    }

    @MutationMapping
    public AuthResponse signIn(@Argument @Valid SignInInput input) {
        return authService.signIn(input);
    }

    @MutationMapping
    public MutationResponse signOut() {
        return authService.signOut();
    }

    @MutationMapping
    public AuthResponse refreshToken(@Argument String refreshToken) {
        return authService.refreshToken(refreshToken);
    }

    @MutationMapping
    public MutationResponse resetPassword(@Argument String email) {
        return authService.resetPassword(email);
    }

    @MutationMapping
    public UserProfileResponse updateProfile(@Argument @Valid UpdateProfileInput input) {
        return MutationPayloads.guard(
                () -> UserProfileResponse.ok(userService.updateProfile(input), "Profile updated successfully"),
                UserProfileResponse::failure);
    }

    @MutationMapping
    public UserProfileResponse completeOnboarding() {
        return MutationPayloads.guard(
                () -> UserProfileResponse.ok(userService.completeOnboarding(), "Onboarding completed"),
                UserProfileResponse::failure);
    }

    @MutationMapping
    public MutationResponse requestAccountDeletion() {
        return MutationPayloads.guard(() -> {
            userService.requestAccountDeletion();
            return MutationResponse.ok("Account deletion requested. Your data will be removed per our retention policy.");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public ConsentResponse updateConsent(@Argument @Valid UpdateConsentInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            ConsentRecord consent = consentService.updateConsent(user, input);
            return ConsentResponse.ok(consent, input.isGranted() ? "Consent granted" : "Consent withdrawn");
        }, ConsentResponse::failure);
    }
}
