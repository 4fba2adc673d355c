package ca.nestsync.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial profile update; null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileInput {

    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @Size(max = 200)
    private String displayName;

    private String timezone;
    private String language;
    private String province;
}
