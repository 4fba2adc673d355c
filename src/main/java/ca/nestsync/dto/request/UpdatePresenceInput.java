package ca.nestsync.dto.request;

import ca.nestsync.entity.CaregiverPresence.PresenceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePresenceInput {

    @NotNull
    private UUID familyId;

    private UUID childId;

    @NotNull
    private PresenceStatus status;

    private String currentActivity;
}
