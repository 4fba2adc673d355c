package ca.nestsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Grants a family's members access to a child.
 *
 * Database Table: family_child_access
 */
@Entity
@Table(name = "family_child_access",
    uniqueConstraints = @UniqueConstraint(name = "uk_family_child", columnNames = {"family_id", "child_id"}),
    indexes = @Index(name = "idx_family_child_child_id", columnList = "child_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyChildAccess {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "family_id", nullable = false)
    private UUID familyId;

    @Column(name = "child_id", nullable = false)
    private UUID childId;

    @Column(name = "access_level", nullable = false, length = 20)
    private String accessLevel = "full";

    @Column(name = "granted_by", nullable = false)
    private UUID grantedBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
