package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.CreateChildInput;
import ca.nestsync.dto.request.UpdateChildInput;
import ca.nestsync.dto.response.ChildView;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.OnboardingStatus;
import ca.nestsync.entity.Child;
import ca.nestsync.entity.Child.DiaperSize;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.exception.ResourceNotFoundException;
import ca.nestsync.repository.ChildRepository;
import ca.nestsync.repository.FamilyChildAccessRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChildService.
 *
 * Tests the child profile flows:
 * - Creation rules (limits, duplicates, date of birth, usage range)
 * - Visibility through ownership or family sharing
 * - Keyset paging of the user's children
 *
 * @see ca.nestsync.service.ChildService
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ChildService Unit Tests")
class ChildServiceTest {

    @Mock
    private ChildRepository childRepository;

    @Mock
    private FamilyChildAccessRepository familyChildAccessRepository;

    @Mock
    private AppSettings appSettings;

    @InjectMocks
    private ChildService childService;

    private UserProfile user;
    private CreateChildInput input;

    @BeforeEach
    void setUp() {
        user = new UserProfile();
        user.setId(UUID.randomUUID());

        input = new CreateChildInput();
        input.setName("  Emma ");
        input.setDateOfBirth(LocalDate.now(ZoneOffset.UTC).minusMonths(6).toString());
        input.setCurrentDiaperSize(DiaperSize.SIZE_2);
        input.setCurrentWeightKg(new BigDecimal("7.4"));
    }

    private Child child(UUID parentId) {
        Child child = new Child();
        child.setId(UUID.randomUUID());
        child.setParentId(parentId);
        child.setName("Emma");
        child.setDateOfBirth(LocalDate.now(ZoneOffset.UTC).minusDays(200));
        child.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC).minusDays(1));
        return child;
    }

    @Test
    @DisplayName("Creating a child trims the name and applies the default daily usage")
    void testCreateChild() {
        // Arrange
        when(appSettings.getMaxChildrenPerUser()).thenReturn(10);
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(1L);
        when(childRepository.existsByParentIdAndNameIgnoreCaseAndDateOfBirthAndIsDeletedFalse(
                eq(user.getId()), eq("Emma"), any(LocalDate.class))).thenReturn(false);
        when(childRepository.save(any(Child.class))).thenAnswer(invocation -> {
            Child child = invocation.getArgument(0);
            child.setId(UUID.randomUUID());
            return child;
        });

        // Act
        ChildView view = childService.createChild(user, input);

        // Assert
        assertEquals("Emma", view.getName());
        assertEquals(user.getId(), view.getParentId());
        assertEquals(Child.DEFAULT_DAILY_USAGE, view.getDailyUsageCount());
        assertEquals(DiaperSize.SIZE_2, view.getCurrentDiaperSize());
        assertEquals(Child.DEFAULT_DAILY_USAGE * 7, view.getWeeklyUsage());
        assertTrue(view.getAgeInDays() > 150);
    }

    @Test
    @DisplayName("Field validation rejects bad input before touching the database")
    void testCreateChildValidation() {
        // Arrange
        CreateChildInput future = new CreateChildInput();
        future.setName("Emma");
        future.setDateOfBirth(LocalDate.now(ZoneOffset.UTC).plusDays(2).toString());
        CreateChildInput usage = new CreateChildInput();
        usage.setName("Emma");
        usage.setDateOfBirth("2024-01-01");
        usage.setDailyUsageCount(21);
        CreateChildInput weight = new CreateChildInput();
        weight.setName("Emma");
        weight.setDateOfBirth("2024-01-01");
        weight.setCurrentWeightKg(BigDecimal.ZERO);
        CreateChildInput badDate = new CreateChildInput();
        badDate.setName("Emma");
        badDate.setDateOfBirth("01/01/2024");

        // Act & Assert
        assertEquals("Date of birth must be in the past",
                assertThrows(IllegalArgumentException.class, () -> childService.createChild(user, future)).getMessage());
        assertEquals("Daily usage count must be between 1 and 20",
                assertThrows(IllegalArgumentException.class, () -> childService.createChild(user, usage)).getMessage());
        assertEquals("Weight must be positive",
                assertThrows(IllegalArgumentException.class, () -> childService.createChild(user, weight)).getMessage());
        assertThrows(IllegalArgumentException.class, () -> childService.createChild(user, badDate));
        verifyNoInteractions(childRepository);
    }

    @Test
    @DisplayName("The per-user child limit is enforced")
    void testCreateChildLimit() {
        // Arrange
        when(appSettings.getMaxChildrenPerUser()).thenReturn(10);
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(10L);

        // Act & Assert
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> childService.createChild(user, input));
        assertEquals("Maximum number of children reached", ex.getMessage());
        verify(childRepository, never()).save(any());
    }

    @Test
    @DisplayName("A duplicate name and date of birth is rejected")
    void testCreateDuplicateChild() {
        // Arrange
        when(appSettings.getMaxChildrenPerUser()).thenReturn(10);
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(1L);
        when(childRepository.existsByParentIdAndNameIgnoreCaseAndDateOfBirthAndIsDeletedFalse(
                eq(user.getId()), eq("Emma"), any(LocalDate.class))).thenReturn(true);

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> childService.createChild(user, input));
    }

    @Test
    @DisplayName("A child shared through a family is accessible; others are not found")
    void testRequireAccessibleChild() {
        // Arrange
        Child shared = child(UUID.randomUUID());
        Child foreign = child(UUID.randomUUID());
        when(childRepository.findByIdAndIsDeletedFalse(shared.getId())).thenReturn(Optional.of(shared));
        when(childRepository.findByIdAndIsDeletedFalse(foreign.getId())).thenReturn(Optional.of(foreign));
        when(familyChildAccessRepository.isSharedWithUser(eq(shared.getId()), eq(user.getId()), any(LocalDateTime.class)))
                .thenReturn(true);
        when(familyChildAccessRepository.isSharedWithUser(eq(foreign.getId()), eq(user.getId()), any(LocalDateTime.class)))
                .thenReturn(false);

        // Act & Assert
        assertSame(shared, childService.requireAccessibleChild(shared.getId(), user));
        assertThrows(ResourceNotFoundException.class, () -> childService.requireAccessibleChild(foreign.getId(), user));
        assertNull(childService.getChild(foreign.getId(), user));
    }

    @Test
    @DisplayName("A member whose family access has expired gets Child not found")
    void testExpiredMemberCannotReachSharedChild() {
        // Arrange
        Child shared = child(UUID.randomUUID());
        when(childRepository.findByIdAndIsDeletedFalse(shared.getId())).thenReturn(Optional.of(shared));
        when(familyChildAccessRepository.isSharedWithUser(eq(shared.getId()), eq(user.getId()), any(LocalDateTime.class)))
                .thenReturn(false);
        LocalDateTime before = LocalDateTime.now(ZoneOffset.UTC);

        // Act
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> childService.requireAccessibleChild(shared.getId(), user));

        // Assert
        assertEquals("Child not found", ex.getMessage());
        ArgumentCaptor<LocalDateTime> now = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(familyChildAccessRepository).isSharedWithUser(eq(shared.getId()), eq(user.getId()), now.capture());
        assertFalse(now.getValue().isBefore(before));
    }

    @Test
    @DisplayName("Own children skip the sharing lookup")
    void testOwnChildAccessible() {
        // Arrange
        Child own = child(user.getId());
        when(childRepository.findByIdAndIsDeletedFalse(own.getId())).thenReturn(Optional.of(own));

        // Act
        Child result = childService.requireAccessibleChild(own.getId(), user);

        // Assert
        assertSame(own, result);
        verifyNoInteractions(familyChildAccessRepository);
    }

    @Test
    @DisplayName("Updates are limited to the owner and validated")
    void testUpdateChild() {
        // Arrange
        Child own = child(user.getId());
        when(childRepository.findByIdAndParentIdAndIsDeletedFalse(own.getId(), user.getId())).thenReturn(Optional.of(own));
        when(childRepository.save(own)).thenReturn(own);
        UpdateChildInput update = new UpdateChildInput();
        update.setCurrentDiaperSize(DiaperSize.SIZE_3);
        update.setDailyUsageCount(6);

        // Act
        ChildView view = childService.updateChild(own.getId(), user, update);

        // Assert
        assertEquals(DiaperSize.SIZE_3, view.getCurrentDiaperSize());
        assertEquals(6, view.getDailyUsageCount());
        assertEquals("Emma", view.getName());
    }

    @Test
    @DisplayName("Deleting marks the child deleted")
    void testDeleteChild() {
        // Arrange
        Child own = child(user.getId());
        when(childRepository.findByIdAndParentIdAndIsDeletedFalse(own.getId(), user.getId())).thenReturn(Optional.of(own));

        // Act
        childService.deleteChild(own.getId(), user);

        // Assert
        assertTrue(own.getIsDeleted());
        assertNotNull(own.getDeletedAt());
        verify(childRepository).save(own);
    }

    @Test
    @DisplayName("Children are paged by creation time with a look-ahead row")
    void testGetMyChildrenPaging() {
        // Arrange
        Child first = child(user.getId());
        Child second = child(user.getId());
        Child third = child(user.getId());
        when(childRepository.findPageAfter(eq(user.getId()), any(LocalDateTime.class), any(UUID.class), any(Pageable.class)))
                .thenReturn(List.of(first, second, third));
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(5L);

        // Act
        Connection<ChildView> page = childService.getMyChildren(user, 2, null);

        // Assert
        assertEquals(2, page.getEdges().size());
        assertTrue(page.getPageInfo().isHasNextPage());
        assertFalse(page.getPageInfo().isHasPreviousPage());
        assertEquals(Cursors.encode(Cursors.CHILD, second.getId()), page.getPageInfo().getEndCursor());
        assertEquals(5, page.getPageInfo().getTotalCount());
    }

    @Test
    @DisplayName("The next page resumes after the cursor child's creation time and id")
    void testGetMyChildrenResumesAfterCursor() {
        // Arrange
        Child last = child(user.getId());
        when(childRepository.findByIdAndParentIdAndIsDeletedFalse(last.getId(), user.getId())).thenReturn(Optional.of(last));
        when(childRepository.findPageAfter(eq(user.getId()), eq(last.getCreatedAt()), eq(last.getId()), any(Pageable.class)))
                .thenReturn(List.of());
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(2L);

        // Act
        Connection<ChildView> page = childService.getMyChildren(user, 2, Cursors.encode(Cursors.CHILD, last.getId()));

        // Assert
        assertTrue(page.getEdges().isEmpty());
        assertFalse(page.getPageInfo().isHasNextPage());
        assertTrue(page.getPageInfo().isHasPreviousPage());
    }

    @Test
    @DisplayName("A cursor for an unknown child is rejected")
    void testGetMyChildrenInvalidCursor() {
        // Arrange
        UUID unknown = UUID.randomUUID();
        when(childRepository.findByIdAndParentIdAndIsDeletedFalse(unknown, user.getId())).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(IllegalArgumentException.class,
                () -> childService.getMyChildren(user, 10, Cursors.encode(Cursors.CHILD, unknown)));
    }

    @Test
    @DisplayName("Onboarding requires child setup until a child exists")
    void testOnboardingStatus() {
        // Arrange
        when(childRepository.countByParentIdAndIsDeletedFalse(user.getId())).thenReturn(0L);

        // Act
        OnboardingStatus status = childService.getOnboardingStatus(user);

        // Assert
        assertFalse(status.isHasChildren());
        assertTrue(status.isRequiresChildSetup());
        assertEquals(0, status.getChildCount());
    }
}
