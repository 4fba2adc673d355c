package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingStatus {

    private boolean userOnboardingCompleted;
    private boolean hasChildren;
    private int childCount;
    private boolean requiresChildSetup;
}
