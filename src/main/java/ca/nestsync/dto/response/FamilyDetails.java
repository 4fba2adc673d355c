package ca.nestsync.dto.response;

import ca.nestsync.entity.CaregiverInvitation;
import ca.nestsync.entity.Family;
import ca.nestsync.entity.FamilyMember;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FamilyDetails {

    private Family family;
    private List<FamilyMember> members;
    private List<ChildView> children;
    private List<CaregiverInvitation> pendingInvitations;
    private FamilyMember.MemberRole myRole;
}
