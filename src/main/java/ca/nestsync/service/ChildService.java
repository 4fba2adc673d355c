package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.CreateChildInput;
import ca.nestsync.dto.request.UpdateChildInput;
import ca.nestsync.dto.response.ChildView;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.OnboardingStatus;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.FamilyChildAccessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Child profiles.
 *
 * A child is visible to its parent and to active members of every family the
 * child has been shared with. Only the parent may change or delete it.
 * Deletion is soft; the row stays for the retention period.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChildService {

    static final int MIN_DAILY_USAGE = 1;
    static final int MAX_DAILY_USAGE = 20;
    private static final int MAX_PAGE_SIZE = 50;

    private final ChildRepository childRepository;
    private final FamilyChildAccessRepository familyChildAccessRepository;
    private final AppSettings appSettings;

    /**
     * Load a child the user may read: their own, or one shared with one of their families.
     *
     * @throws ResourceNotFoundException if the child does not exist or is not visible
     */
    @Transactional(readOnly = true)
    public Child requireAccessibleChild(UUID childId, UserProfile user) {
        Child child = childRepository.findByIdAndIsDeletedFalse(childId)
                .orElseThrow(() -> ResourceNotFoundException.child(childId));
        if (child.getParentId().equals(user.getId())
                || familyChildAccessRepository.isSharedWithUser(childId, user.getId(), LocalDateTime.now(ZoneOffset.UTC))) {
            return child;
        }
        log.warn("User {} attempted to access child {} without access", user.getId(), childId);
        throw ResourceNotFoundException.child(childId);
    }

    /**
     * Load a child owned by the user.
     *
     * @throws ResourceNotFoundException if the child does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public Child requireOwnedChild(UUID childId, UserProfile user) {
        return childRepository.findByIdAndParentIdAndIsDeletedFalse(childId, user.getId())
                .orElseThrow(() -> ResourceNotFoundException.child(childId));
    }

    @Transactional(readOnly = true)
    public ChildView getChild(UUID childId, UserProfile user) {
        try {
            return ChildView.from(requireAccessibleChild(childId, user), today());
        } catch (ResourceNotFoundException ex) {
            return null;
        }
    }

    @Transactional
    public ChildView createChild(UserProfile user, CreateChildInput input) {
        String name = requireName(input.getName());
        LocalDate dateOfBirth = parseDateOfBirth(input.getDateOfBirth());
        int dailyUsage = input.getDailyUsageCount() != null ? input.getDailyUsageCount() : Child.DEFAULT_DAILY_USAGE;
        validateDailyUsage(dailyUsage);
        validateMeasurement(input.getCurrentWeightKg(), "Weight");
        validateMeasurement(input.getCurrentHeightCm(), "Height");

        if (childRepository.countByParentIdAndIsDeletedFalse(user.getId()) >= appSettings.getMaxChildrenPerUser()) {
            throw new IllegalStateException("Maximum number of children reached");
        }
        if (childRepository.existsByParentIdAndNameIgnoreCaseAndDateOfBirthAndIsDeletedFalse(user.getId(), name, dateOfBirth)) {
            throw new IllegalStateException("A child with this name and date of birth already exists");
        }

        Child child = new Child();
        child.setParentId(user.getId());
        child.setName(name);
        child.setDateOfBirth(dateOfBirth);
        child.setGender(input.getGender());
        if (input.getCurrentDiaperSize() != null) {
            child.setCurrentDiaperSize(input.getCurrentDiaperSize());
        }
        child.setCurrentWeightKg(input.getCurrentWeightKg());
        child.setCurrentHeightCm(input.getCurrentHeightCm());
        child.setDailyUsageCount(dailyUsage);
        child.setHasSensitiveSkin(Boolean.TRUE.equals(input.getHasSensitiveSkin()));
        child.setHasAllergies(Boolean.TRUE.equals(input.getHasAllergies()));
        child.setAllergiesNotes(input.getAllergiesNotes());
        if (input.getPreferredBrands() != null) {
            child.setPreferredBrands(new ArrayList<>(input.getPreferredBrands()));
        }
        child.setSpecialNeeds(input.getSpecialNeeds());

        Child saved = childRepository.save(child);
        log.info("Child {} created for user {}", saved.getId(), user.getId());
        return ChildView.from(saved, today());
    }

    @Transactional
    public ChildView updateChild(UUID childId, UserProfile user, UpdateChildInput input) {
        Child child = requireOwnedChild(childId, user);

        if (input.getName() != null) {
            child.setName(requireName(input.getName()));
        }
        if (input.getDateOfBirth() != null) {
            child.setDateOfBirth(parseDateOfBirth(input.getDateOfBirth()));
        }
        if (input.getGender() != null) {
            child.setGender(input.getGender());
        }
        if (input.getCurrentDiaperSize() != null) {
            child.setCurrentDiaperSize(input.getCurrentDiaperSize());
        }
        if (input.getCurrentWeightKg() != null) {
            validateMeasurement(input.getCurrentWeightKg(), "Weight");
            child.setCurrentWeightKg(input.getCurrentWeightKg());
        }
        if (input.getCurrentHeightCm() != null) {
            validateMeasurement(input.getCurrentHeightCm(), "Height");
            child.setCurrentHeightCm(input.getCurrentHeightCm());
        }
        if (input.getDailyUsageCount() != null) {
            validateDailyUsage(input.getDailyUsageCount());
            child.setDailyUsageCount(input.getDailyUsageCount());
        }
        if (input.getHasSensitiveSkin() != null) {
            child.setHasSensitiveSkin(input.getHasSensitiveSkin());
        }
        if (input.getHasAllergies() != null) {
            child.setHasAllergies(input.getHasAllergies());
        }
        if (input.getAllergiesNotes() != null) {
            child.setAllergiesNotes(input.getAllergiesNotes());
        }
        if (input.getPreferredBrands() != null) {
            child.setPreferredBrands(new ArrayList<>(input.getPreferredBrands()));
        }
        if (input.getSpecialNeeds() != null) {
            child.setSpecialNeeds(input.getSpecialNeeds());
        }
        if (input.getOnboardingCompleted() != null) {
            child.setOnboardingCompleted(input.getOnboardingCompleted());
        }

        Child saved = childRepository.save(child);
        log.info("Child {} updated by user {}", childId, user.getId());
        return ChildView.from(saved, today());
    }

    @Transactional
    public void deleteChild(UUID childId, UserProfile user) {
        Child child = requireOwnedChild(childId, user);
        child.softDelete(LocalDateTime.now(ZoneOffset.UTC));
        childRepository.save(child);
        log.info("Child {} soft-deleted by user {}", childId, user.getId());
    }

    /**
     * The user's own children, oldest first.
     *
     * @param first page size (1..50)
     * @param after cursor of the last child of the previous page
     */
    @Transactional(readOnly = true)
    public Connection<ChildView> getMyChildren(UserProfile user, int first, String after) {
        int pageSize = Math.max(1, Math.min(first, MAX_PAGE_SIZE));
        LocalDateTime afterCreatedAt = LocalDateTime.of(1970, 1, 1, 0, 0);
        UUID afterId = new UUID(0L, 0L);
        if (after != null && !after.isBlank()) {
            afterId = Cursors.decode(Cursors.CHILD, after);
            afterCreatedAt = childRepository.findByIdAndParentIdAndIsDeletedFalse(afterId, user.getId())
                    .map(Child::getCreatedAt)
                    .orElseThrow(() -> new IllegalArgumentException("Invalid cursor"));
        }

        List<Child> rows = childRepository.findPageAfter(
                user.getId(), afterCreatedAt, afterId, PageRequest.of(0, pageSize + 1));
        boolean hasNext = rows.size() > pageSize;
        LocalDate today = today();
        List<ChildView> page = rows.stream().limit(pageSize).map(c -> ChildView.from(c, today)).toList();
        int total = (int) childRepository.countByParentIdAndIsDeletedFalse(user.getId());

        return Connection.of(page, c -> Cursors.encode(Cursors.CHILD, c.getId()), hasNext, after != null, total);
    }

    @Transactional(readOnly = true)
    public OnboardingStatus getOnboardingStatus(UserProfile user) {
        int count = (int) childRepository.countByParentIdAndIsDeletedFalse(user.getId());
        boolean onboarded = Boolean.TRUE.equals(user.getOnboardingCompleted());
        return new OnboardingStatus(onboarded, count > 0, count, count == 0);
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Child name is required");
        }
        return name.trim();
    }

    private LocalDate parseDateOfBirth(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Date of birth is required");
        }
        LocalDate dateOfBirth;
        try {
            dateOfBirth = LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Date of birth must be a date in yyyy-MM-dd format");
        }
        if (dateOfBirth.isAfter(today())) {
            throw new IllegalArgumentException("Date of birth must be in the past");
        }
        return dateOfBirth;
    }

    private void validateDailyUsage(int dailyUsage) {
        if (dailyUsage < MIN_DAILY_USAGE || dailyUsage > MAX_DAILY_USAGE) {
            throw new IllegalArgumentException(
                    String.format("Daily usage count must be between %d and %d", MIN_DAILY_USAGE, MAX_DAILY_USAGE));
        }
    }

    private void validateMeasurement(BigDecimal value, String label) {
        if (value != null && value.signum() <= 0) {
            throw new IllegalArgumentException(label + " must be positive");
        }
    }

    private LocalDate today() {
        return LocalDate.now(ZoneOffset.UTC);
    }
}
