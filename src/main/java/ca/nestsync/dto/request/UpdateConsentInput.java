package ca.nestsync.dto.request;

import ca.nestsync.entity.ConsentRecord.ConsentType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateConsentInput {

    @NotNull
    private ConsentType consentType;

    private boolean granted;

    private String reason;
}
