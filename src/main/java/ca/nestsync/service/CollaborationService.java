package ca.nestsync.service;

import ca.nestsync.dto.request.CreateFamilyInput;
import ca.nestsync.dto.request.InviteCaregiverInput;
import ca.nestsync.dto.request.UpdatePresenceInput;
import ca.nestsync.dto.response.ChildView;
import ca.nestsync.dto.response.FamilyDetails;
import ca.nestsync.entity.ActivityLog;
import ca.nestsync.entity.CaregiverInvitation;
import ca.nestsync.entity.CaregiverInvitation.InvitationStatus;
import ca.nestsync.entity.CaregiverPresence;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.Family;
import ca.nestsync.entity.FamilyChildAccess;
import ca.nestsync.entity.FamilyMember;
import ca.nestsync.entity.FamilyMember.MemberRole;
import ca.nestsync.entity.FamilyMember.MemberStatus;
import ca.nestsync.entity.NotificationQueue.NotificationPriority;
import ca.nestsync.entity.NotificationQueue.NotificationType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.ActivityLogRepository;
import ca.nestsync.repository.CaregiverInvitationRepository;
import ca.nestsync.repository.CaregiverPresenceRepository;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.FamilyChildAccessRepository;
import ca.nestsync.repository.FamilyMemberRepository;
import ca.nestsync.repository.FamilyRepository;
import ca.nestsync.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Families, caregiver invitations, shared children and presence.
 *
 * Every state change writes a collaboration log entry.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollaborationService {

    static final int INVITATION_VALIDITY_DAYS = 7;
    static final int TOKEN_BYTES = 32;
    static final int DATA_RETENTION_DAYS = 2555;
    static final Set<String> ACCESS_LEVELS = Set.of("full", "view_only", "limited");
    private static final int MAX_LOG_ENTRIES = 100;

    private final FamilyRepository familyRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final FamilyChildAccessRepository familyChildAccessRepository;
    private final CaregiverInvitationRepository invitationRepository;
    private final CaregiverPresenceRepository presenceRepository;
    private final ActivityLogRepository activityLogRepository;
    private final ChildRepository childRepository;
    private final UserProfileRepository userProfileRepository;
    private final ChildService childService;
    private final FamilyPermissionService permissionService;
    private final NotificationService notificationService;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Create a family with the caller as its first FAMILY_CORE member.
     */
    @Transactional
    public Family createFamily(UserProfile user, CreateFamilyInput input) {
        if (input.getName() == null || input.getName().isBlank()) {
            throw new IllegalArgumentException("Family name is required");
        }

        Family family = new Family();
        family.setName(input.getName().trim());
        family.setDescription(input.getDescription());
        if (input.getFamilyType() != null) {
            family.setFamilyType(input.getFamilyType());
        }
        family.setCreatedBy(user.getId());
        family.setSettings(defaultSettings());
        family = familyRepository.save(family);

        FamilyMember member = new FamilyMember();
        member.setFamilyId(family.getId());
        member.setUserId(user.getId());
        member.setRole(MemberRole.FAMILY_CORE);
        member.setPermissions(FamilyPermissionService.defaultPermissions(MemberRole.FAMILY_CORE));
        member.setStatus(MemberStatus.ACTIVE);
        member.setJoinedAt(now());
        familyMemberRepository.save(member);

        record(family.getId(), user.getId(), null, "family_created", "Family '" + family.getName() + "' created");
        log.info("Family {} created by user {}", family.getId(), user.getId());
        return family;
    }

    @Transactional(readOnly = true)
    public List<Family> getMyFamilies(UserProfile user) {
        return familyRepository.findActiveForUser(user.getId());
    }

    @Transactional(readOnly = true)
    public FamilyDetails getFamilyDetails(UUID familyId, UserProfile user) {
        FamilyMember me = permissionService.requirePermission(familyId, user, FamilyPermissionService.VIEW_DATA);
        Family family = requireFamily(familyId);

        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        List<UUID> childIds = familyChildAccessRepository.findByFamilyId(familyId).stream()
                .map(FamilyChildAccess::getChildId)
                .toList();
        List<ChildView> children = childRepository.findAllById(childIds).stream()
                .filter(child -> !Boolean.TRUE.equals(child.getIsDeleted()))
                .map(child -> ChildView.from(child, today))
                .toList();

        return new FamilyDetails(
                family,
                familyMemberRepository.findByFamilyIdAndStatus(familyId, MemberStatus.ACTIVE),
                children,
                invitationRepository.findByFamilyIdAndStatusOrderByCreatedAtDesc(familyId, InvitationStatus.PENDING),
                me.getRole());
    }

    /**
     * Invite a caregiver by email. A pending invitation for the same email is
     * returned as-is instead of creating a second one.
     */
    @Transactional
    public CaregiverInvitation inviteCaregiver(UUID familyId, UserProfile user, InviteCaregiverInput input) {
        permissionService.requirePermission(familyId, user, FamilyPermissionService.INVITE_MEMBERS);
        Family family = requireFamily(familyId);
        String email = input.getEmail().trim().toLowerCase(Locale.ROOT);

        Optional<CaregiverInvitation> existing = invitationRepository.findFirstByFamilyIdAndEmailIgnoreCaseAndStatus(
                familyId, email, InvitationStatus.PENDING);
        if (existing.isPresent()) {
            CaregiverInvitation pending = existing.get();
            if (pending.isRedeemable(now())) {
                log.info("Returning existing pending invitation {} for family {}", pending.getId(), familyId);
                return pending;
            }
            pending.setStatus(InvitationStatus.EXPIRED);
            invitationRepository.save(pending);
        }

        CaregiverInvitation invitation = new CaregiverInvitation();
        invitation.setFamilyId(familyId);
        invitation.setInvitedBy(user.getId());
        invitation.setEmail(email);
        invitation.setRole(input.getRole());
        invitation.setMessage(input.getMessage());
        invitation.setInvitationToken(generateToken());
        invitation.setStatus(InvitationStatus.PENDING);
        invitation.setExpiresAt(now().plusDays(INVITATION_VALIDITY_DAYS));
        invitation = invitationRepository.save(invitation);

        record(familyId, user.getId(), null, "member_invited", "Invited " + email + " as " + input.getRole());
        sendInvitationNotice(invitation, family, user);
        log.info("Invitation {} created for family {} by user {}", invitation.getId(), familyId, user.getId());
        return invitation;
    }

    @Transactional
    public Family acceptInvitation(String token, UserProfile user) {
        LocalDateTime now = now();
        CaregiverInvitation invitation = invitationRepository.findByInvitationToken(token)
                .filter(i -> i.isRedeemable(now))
                .orElseThrow(() -> new IllegalStateException("Invalid or expired invitation"));
        if (!invitation.getEmail().equalsIgnoreCase(user.getEmail())) {
            throw new IllegalStateException("Email mismatch");
        }

        FamilyMember member = familyMemberRepository.findByFamilyIdAndUserId(invitation.getFamilyId(), user.getId())
                .orElseGet(FamilyMember::new);
        if (member.getId() != null && member.getStatus() == MemberStatus.ACTIVE) {
            throw new IllegalStateException("User is already a member of this family");
        }

        member.setFamilyId(invitation.getFamilyId());
        member.setUserId(user.getId());
        member.setRole(invitation.getRole());
        member.setPermissions(FamilyPermissionService.defaultPermissions(invitation.getRole()));
        member.setStatus(MemberStatus.ACTIVE);
        member.setInvitedBy(invitation.getInvitedBy());
        member.setJoinedAt(now);
        member.setAccessExpiresAt(invitation.getRole() == MemberRole.INSTITUTIONAL
                ? now.plusDays(FamilyPermissionService.INSTITUTIONAL_ACCESS_DAYS)
                : null);
        familyMemberRepository.save(member);

        invitation.setStatus(InvitationStatus.ACCEPTED);
        invitation.setAcceptedAt(now);
        invitation.setAcceptedBy(user.getId());
        invitationRepository.save(invitation);

        record(invitation.getFamilyId(), user.getId(), null, "member_joined",
                user.getEmail() + " joined as " + invitation.getRole());
        log.info("User {} joined family {} as {}", user.getId(), invitation.getFamilyId(), invitation.getRole());
        return requireFamily(invitation.getFamilyId());
    }

    @Transactional
    public void declineInvitation(String token, UserProfile user) {
        CaregiverInvitation invitation = invitationRepository.findByInvitationToken(token)
                .filter(i -> i.isRedeemable(now()))
                .orElseThrow(() -> new IllegalStateException("Invalid or expired invitation"));
        if (!invitation.getEmail().equalsIgnoreCase(user.getEmail())) {
            throw new IllegalStateException("Email mismatch");
        }

        invitation.setStatus(InvitationStatus.DECLINED);
        invitationRepository.save(invitation);
        record(invitation.getFamilyId(), user.getId(), null, "invitation_declined",
                user.getEmail() + " declined the invitation");
        log.info("Invitation {} declined by user {}", invitation.getId(), user.getId());
    }

    @Transactional
    public void cancelInvitation(UUID invitationId, UserProfile user) {
        CaregiverInvitation invitation = invitationRepository.findById(invitationId)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation not found"));
        permissionService.requirePermission(invitation.getFamilyId(), user, FamilyPermissionService.INVITE_MEMBERS);
        if (invitation.getStatus() != InvitationStatus.PENDING) {
            throw new IllegalStateException("Only pending invitations can be cancelled");
        }

        invitation.setStatus(InvitationStatus.CANCELLED);
        invitationRepository.save(invitation);
        record(invitation.getFamilyId(), user.getId(), null, "invitation_cancelled",
                "Invitation for " + invitation.getEmail() + " cancelled");
        log.info("Invitation {} cancelled by user {}", invitationId, user.getId());
    }

    /**
     * Deactivate a member. The last active FAMILY_CORE member stays.
     */
    @Transactional
    public void removeFamilyMember(UUID familyId, UUID memberId, UserProfile user) {
        permissionService.requirePermission(familyId, user, FamilyPermissionService.MANAGE_SETTINGS);
        FamilyMember member = familyMemberRepository.findByIdAndFamilyId(memberId, familyId)
                .filter(m -> m.getStatus() == MemberStatus.ACTIVE)
                .orElseThrow(() -> new ResourceNotFoundException("Family member not found"));

        if (member.getRole() == MemberRole.FAMILY_CORE
                && familyMemberRepository.countByFamilyIdAndRoleAndStatus(familyId, MemberRole.FAMILY_CORE, MemberStatus.ACTIVE) <= 1) {
            throw new IllegalStateException("Cannot remove the last family core member");
        }

        member.setStatus(MemberStatus.INACTIVE);
        familyMemberRepository.save(member);
        record(familyId, user.getId(), null, "member_removed", "Member " + member.getUserId() + " removed");
        log.info("Member {} removed from family {} by user {}", memberId, familyId, user.getId());
    }

    @Transactional
    public void addChildToFamily(UUID familyId, UUID childId, String accessLevel, UserProfile user) {
        permissionService.requireMember(familyId, user);
        Child child = childService.requireOwnedChild(childId, user);
        String level = accessLevel == null ? "full" : accessLevel.trim().toLowerCase(Locale.ROOT);
        if (!ACCESS_LEVELS.contains(level)) {
            throw new IllegalArgumentException("Access level must be one of " + ACCESS_LEVELS);
        }
        if (familyChildAccessRepository.existsByFamilyIdAndChildId(familyId, childId)) {
            throw new IllegalStateException("Child already has access to this family");
        }

        FamilyChildAccess access = new FamilyChildAccess();
        access.setFamilyId(familyId);
        access.setChildId(child.getId());
        access.setAccessLevel(level);
        access.setGrantedBy(user.getId());
        familyChildAccessRepository.save(access);

        record(familyId, user.getId(), child.getId(), "child_shared", child.getName() + " shared with the family");
        log.info("Child {} shared with family {} ({})", childId, familyId, level);
    }

    @Transactional
    public CaregiverPresence updatePresence(UserProfile user, UpdatePresenceInput input) {
        permissionService.requireMember(input.getFamilyId(), user);
        if (input.getChildId() != null) {
            childService.requireAccessibleChild(input.getChildId(), user);
        }

        CaregiverPresence presence = presenceRepository.findByFamilyIdAndUserId(input.getFamilyId(), user.getId())
                .orElseGet(CaregiverPresence::new);
        presence.setFamilyId(input.getFamilyId());
        presence.setUserId(user.getId());
        presence.setChildId(input.getChildId());
        presence.setStatus(input.getStatus());
        presence.setCurrentActivity(input.getCurrentActivity());
        presence.setLastSeenAt(now());

        log.debug("Presence of user {} in family {}: {}", user.getId(), input.getFamilyId(), input.getStatus());
        return presenceRepository.save(presence);
    }

    @Transactional(readOnly = true)
    public List<CaregiverPresence> getFamilyPresence(UUID familyId, UserProfile user) {
        permissionService.requireMember(familyId, user);
        return presenceRepository.findByFamilyIdOrderByLastSeenAtDesc(familyId);
    }

    @Transactional(readOnly = true)
    public List<ActivityLog> getCollaborationLog(UUID familyId, int limit, UserProfile user) {
        permissionService.requirePermission(familyId, user, FamilyPermissionService.VIEW_DATA);
        int size = Math.max(1, Math.min(limit, MAX_LOG_ENTRIES));
        return activityLogRepository.findByFamilyIdOrderByCreatedAtDesc(familyId, PageRequest.of(0, size));
    }

    String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private void sendInvitationNotice(CaregiverInvitation invitation, Family family, UserProfile inviter) {
        String inviterName = inviter.getDisplayName() != null ? inviter.getDisplayName() : inviter.getEmail();
        userProfileRepository.findByEmailIgnoreCaseAndIsDeletedFalse(invitation.getEmail())
                .ifPresentOrElse(invitee -> {
                    Map<String, Object> payload = new HashMap<>();
                    payload.put("familyId", family.getId().toString());
                    payload.put("invitationId", invitation.getId().toString());
                    notificationService.notifySystem(invitee.getId(), NotificationType.SYSTEM_UPDATE,
                            NotificationPriority.IMPORTANT, null, "Family invitation",
                            inviterName + " invited you to join " + family.getName(), payload);
                }, () -> log.info("No account for {}; invitation {} to family {} is shared by link",
                        invitation.getEmail(), invitation.getId(), family.getId()));
    }

    private Family requireFamily(UUID familyId) {
        return familyRepository.findByIdAndIsDeletedFalse(familyId)
                .orElseThrow(() -> new ResourceNotFoundException("Family not found"));
    }

    private void record(UUID familyId, UUID userId, UUID childId, String actionType, String description) {
        activityLogRepository.save(new ActivityLog(familyId, userId, childId, actionType, description));
    }

    private Map<String, Object> defaultSettings() {
        Map<String, Object> settings = new HashMap<>();
        settings.put("timezone", "America/Toronto");
        settings.put("language", "en-CA");
        settings.put("privacy_level", "family_only");
        settings.put("allow_guest_access", false);
        settings.put("data_retention_days", DATA_RETENTION_DAYS);
        settings.put("notification_settings", Map.of(
                "real_time_updates", true,
                "activity_notifications", true,
                "member_join_notifications", true));
        return settings;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
