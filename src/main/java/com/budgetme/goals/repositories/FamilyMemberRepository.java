package com.budgetme.goals.repositories;

import com.budgetme.goals.entities.FamilyMember;
import com.budgetme.goals.enums.MembershipStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FamilyMemberRepository extends JpaRepository<FamilyMember, UUID> {

    Optional<FamilyMember> findByFamilyIdAndUserId(UUID familyId, UUID userId);

    List<FamilyMember> findByUserIdAndStatus(UUID userId, MembershipStatus status);
}
