package ca.nestsync.dto.response;

import ca.nestsync.entity.CaregiverInvitation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvitationResponse {

    private boolean success;
    private String message;
    private String error;
    private CaregiverInvitation invitation;

    public static InvitationResponse ok(CaregiverInvitation invitation, String message) {
        return new InvitationResponse(true, message, null, invitation);
    }

    public static InvitationResponse failure(String error) {
        return new InvitationResponse(false, null, error, null);
    }
}
