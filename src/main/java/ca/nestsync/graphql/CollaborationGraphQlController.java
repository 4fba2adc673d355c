package ca.nestsync.graphql;

import ca.nestsync.dto.request.CreateFamilyInput;
import ca.nestsync.dto.request.InviteCaregiverInput;
import ca.nestsync.dto.request.UpdatePresenceInput;
import ca.nestsync.dto.response.FamilyDetails;
import ca.nestsync.dto.response.FamilyResponse;
import ca.nestsync.dto.response.InvitationResponse;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.PresenceResponse;
import ca.nestsync.entity.ActivityLog;
import ca.nestsync.entity.CaregiverPresence;
import ca.nestsync.entity.Family;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.CollaborationService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.UUID;

/**
 * Families, caregiver invitations, presence and the collaboration log.
 *
 * Permission checks live in the service; a missing permission surfaces as a
 * FORBIDDEN GraphQL error rather than a failure payload.
 */
@Controller
@RequiredArgsConstructor
public class CollaborationGraphQlController {

    private final CollaborationService collaborationService;
    private final UserService userService;

    @QueryMapping
    public List<Family> myFamilies() {
        return collaborationService.getMyFamilies(userService.requireCurrentUser());
    }

    @QueryMapping
    public FamilyDetails familyDetails(@Argument UUID familyId) {
        return collaborationService.getFamilyDetails(familyId, userService.requireCurrentUser());
    }

    @QueryMapping
    public List<CaregiverPresence> familyPresence(@Argument UUID familyId) {
        return collaborationService.getFamilyPresence(familyId, userService.requireCurrentUser());
    }

    @QueryMapping
    public List<ActivityLog> collaborationLog(@Argument UUID familyId, @Argument Integer limit) {
        return collaborationService.getCollaborationLog(familyId, limit != null ? limit : 50,
                userService.requireCurrentUser());
    }

    @MutationMapping
    public FamilyResponse createFamily(@Argument @Valid CreateFamilyInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> FamilyResponse.ok(collaborationService.createFamily(user, input), "Family created successfully"),
                FamilyResponse::failure);
    }

    @MutationMapping
    public InvitationResponse inviteCaregiver(@Argument UUID familyId, @Argument @Valid InviteCaregiverInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> InvitationResponse.ok(collaborationService.inviteCaregiver(familyId, user, input),
                        "Invitation sent to " + input.getEmail()),
                InvitationResponse::failure);
    }

    @MutationMapping
    public FamilyResponse acceptInvitation(@Argument String token) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> FamilyResponse.ok(collaborationService.acceptInvitation(token, user), "Successfully joined family"),
                FamilyResponse::failure);
    }

    @MutationMapping
    public MutationResponse declineInvitation(@Argument String token) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            collaborationService.declineInvitation(token, user);
            return MutationResponse.ok("Invitation declined");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public MutationResponse cancelInvitation(@Argument UUID invitationId) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            collaborationService.cancelInvitation(invitationId, user);
            return MutationResponse.ok("Invitation cancelled");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public MutationResponse removeFamilyMember(@Argument UUID familyId, @Argument UUID memberId) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            collaborationService.removeFamilyMember(familyId, memberId, user);
            return MutationResponse.ok("Family member removed");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public MutationResponse addChildToFamily(@Argument UUID familyId, @Argument UUID childId,
                                             @Argument String accessLevel) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            collaborationService.addChildToFamily(familyId, childId, accessLevel != null ? accessLevel : "full", user);
            return MutationResponse.ok("Child added to family successfully");
        }, MutationResponse::failure);
    }

    @MutationMapping
    public PresenceResponse updatePresence(@Argument @Valid UpdatePresenceInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> PresenceResponse.ok(collaborationService.updatePresence(user, input), "Presence updated successfully"),
                PresenceResponse::failure);
    }
}
