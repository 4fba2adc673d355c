package ca.nestsync.service;

import ca.nestsync.entity.FamilyMember;
import ca.nestsync.entity.FamilyMember.MemberRole;
import ca.nestsync.entity.FamilyMember.MemberStatus;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.exception.UnauthorizedException;
import ca.nestsync.repository.FamilyMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Role-based permissions of family members.
 *
 * Actions map to keys of the member's permission document:
 * <pre>
 * invite_members      -> can_invite_members
 * edit_child_profiles -> can_edit_child_profiles
 * manage_settings     -> can_manage_settings
 * export_data         -> can_export_data
 * log_activity        -> allowed_activity_types
 * view_data           -> can_view_all_data
 * </pre>
 *
 * A boolean value is taken as-is, a list grants when it contains "all" or the
 * action, and a string grants unless it is false, none or disabled. Unknown
 * actions, missing keys, inactive members and expired access deny.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FamilyPermissionService {

    public static final String INVITE_MEMBERS = "invite_members";
    public static final String EDIT_CHILD_PROFILES = "edit_child_profiles";
    public static final String MANAGE_SETTINGS = "manage_settings";
    public static final String EXPORT_DATA = "export_data";
    public static final String LOG_ACTIVITY = "log_activity";
    public static final String VIEW_DATA = "view_data";

    /**
     * Institutional members lose access this many days after joining.
     */
    public static final int INSTITUTIONAL_ACCESS_DAYS = 7;

    private static final Map<String, String> ACTION_PERMISSION_KEYS = Map.of(
            INVITE_MEMBERS, "can_invite_members",
            EDIT_CHILD_PROFILES, "can_edit_child_profiles",
            MANAGE_SETTINGS, "can_manage_settings",
            EXPORT_DATA, "can_export_data",
            LOG_ACTIVITY, "allowed_activity_types",
            VIEW_DATA, "can_view_all_data");

    private static final List<String> DENYING_STRINGS = List.of("false", "none", "disabled");

    private final FamilyMemberRepository familyMemberRepository;

    /**
     * The caller's active, unexpired membership.
     *
     * @throws ResourceNotFoundException when the caller is not a member, so
     *         families stay invisible to outsiders
     */
    public FamilyMember requireMember(UUID familyId, UserProfile user) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return familyMemberRepository.findByFamilyIdAndUserId(familyId, user.getId())
                .filter(m -> m.getStatus() == MemberStatus.ACTIVE && !m.isAccessExpired(now))
                .orElseThrow(() -> new ResourceNotFoundException("Family not found"));
    }

    /**
     * The caller's membership, which must grant the action.
     */
    public FamilyMember requirePermission(UUID familyId, UserProfile user, String action) {
        FamilyMember member = requireMember(familyId, user);
        if (!hasPermission(member, action, LocalDateTime.now(ZoneOffset.UTC))) {
            log.warn("User {} denied '{}' in family {}", user.getId(), action, familyId);
            throw UnauthorizedException.missingPermission(action);
        }
        return member;
    }

    public boolean hasPermission(FamilyMember member, String action, LocalDateTime now) {
        if (member == null || member.getStatus() != MemberStatus.ACTIVE || member.isAccessExpired(now)) {
            return false;
        }
        String key = ACTION_PERMISSION_KEYS.get(action);
        if (key == null) {
            return false;
        }
        Map<String, Object> permissions = member.getPermissions() != null ? member.getPermissions() : Map.of();
        return grants(permissions.get(key), action);
    }

    static boolean grants(Object value, String action) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            return values.contains("all") || values.contains(action);
        }
        if (value instanceof String) {
            return !DENYING_STRINGS.contains(value);
        }
        return false;
    }

    /**
     * Permission document given to a new member of the role.
     */
    public static Map<String, Object> defaultPermissions(MemberRole role) {
        Map<String, Object> permissions = new HashMap<>();
        permissions.put("can_view_all_data", false);
        permissions.put("can_edit_child_profiles", false);
        permissions.put("can_invite_members", false);
        permissions.put("can_manage_settings", false);
        permissions.put("can_export_data", false);
        permissions.put("can_access_historical_data", false);
        permissions.put("allowed_activity_types", List.of());
        permissions.put("can_edit_own_activities", false);
        permissions.put("can_edit_others_activities", false);
        permissions.put("can_bulk_log", false);

        switch (role) {
            case FAMILY_CORE:
                permissions.put("can_view_all_data", true);
                permissions.put("can_edit_child_profiles", true);
                permissions.put("can_invite_members", true);
                permissions.put("can_manage_settings", true);
                permissions.put("can_export_data", true);
                permissions.put("can_access_historical_data", true);
                permissions.put("allowed_activity_types", List.of("all"));
                permissions.put("can_edit_own_activities", true);
                permissions.put("can_edit_others_activities", true);
                permissions.put("can_bulk_log", true);
                break;
            case EXTENDED_FAMILY:
                permissions.put("can_view_all_data", true);
                permissions.put("can_access_historical_data", true);
                permissions.put("allowed_activity_types", List.of("all"));
                permissions.put("can_edit_own_activities", true);
                break;
            case PROFESSIONAL:
                permissions.put("can_view_all_data", true);
                permissions.put("can_access_historical_data", "relevant_only");
                permissions.put("can_export_data", "professional_reports_only");
                permissions.put("allowed_activity_types", List.of("professional_scope"));
                permissions.put("can_edit_own_activities", true);
                break;
            case INSTITUTIONAL:
                permissions.put("can_view_all_data", "basic_info_only");
                permissions.put("allowed_activity_types", List.of("basic_only"));
                permissions.put("can_edit_own_activities", "within_time_window");
                permissions.put("time_restrictions", Map.of(
                        "session_duration_hours", 8,
                        "auto_expire_days", INSTITUTIONAL_ACCESS_DAYS,
                        "activity_window_minutes", 30));
                break;
            default:
                break;
        }
        return permissions;
    }
}
