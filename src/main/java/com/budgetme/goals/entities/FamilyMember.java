package com.budgetme.goals.entities;

import com.budgetme.goals.enums.FamilyRole;
import com.budgetme.goals.enums.MembershipStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "family_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_family_members_family_user", columnNames = {"family_id", "user_id"}),
        indexes = @Index(name = "idx_family_members_user_id", columnList = "user_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FamilyMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "family_id", nullable = false)
    private UUID familyId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FamilyRole role;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @Builder.Default
    @Column(name = "can_contribute_goals", nullable = false)
    private boolean canContributeGoals = true;

    @Column(name = "joined_at")
    private LocalDateTime joinedAt;

    public boolean isActive() {
        return status == MembershipStatus.ACTIVE;
    }
}
