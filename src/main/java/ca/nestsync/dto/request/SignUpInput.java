package ca.nestsync.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input for account registration.
 *
 * Both {@code acceptPrivacyPolicy} and {@code acceptTermsOfService} must be true;
 * the marketing and analytics flags create optional consent records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignUpInput {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 8, message = "Password must be at least 8 characters")
    private String password;

    private String firstName;
    private String lastName;
    private String timezone;
    private String language;
    private String province;

    private boolean acceptPrivacyPolicy;
    private boolean acceptTermsOfService;
    private boolean marketingConsent;
    private boolean analyticsConsent;
}
