package com.budgetme.goals.services.contributions.permission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.budgetme.goals.entities.Family;
import com.budgetme.goals.entities.FamilyMember;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.FamilyRole;
import com.budgetme.goals.enums.MembershipStatus;
import com.budgetme.goals.exceptions.StoreException;
import com.budgetme.goals.services.contributions.ContributionErrorType;
import com.budgetme.goals.services.contributions.store.ContributionStore;

@ExtendWith(MockitoExtension.class)
class GoalPermissionGateTest {

    @Mock
    private ContributionStore store;

    @InjectMocks
    private GoalPermissionGate gate;

    private final UUID userId = UUID.randomUUID();
    private final UUID familyId = UUID.randomUUID();
    private Family family;

    @BeforeEach
    void setUp() {
        family = new Family();
        family.setId(familyId);
        family.setFamilyName("Silva");
        family.setCreatedBy(UUID.randomUUID());
    }

    private Goal personalGoal(UUID owner) {
        return Goal.builder()
                .id(UUID.randomUUID())
                .userId(owner)
                .goalName("Reserva")
                .targetAmount(new BigDecimal("1000"))
                .build();
    }

    private Goal familyGoal() {
        Goal goal = personalGoal(family.getCreatedBy());
        goal.setFamilyId(familyId);
        return goal;
    }

    private FamilyMember member(FamilyRole role, MembershipStatus status, boolean canContribute) {
        return FamilyMember.builder()
                .familyId(familyId)
                .userId(userId)
                .role(role)
                .status(status)
                .canContributeGoals(canContribute)
                .build();
    }

    @Test
    void personalGoal_owner_isAllowed() {
        PermissionDecision decision = gate.canAccess(userId, personalGoal(userId));

        assertTrue(decision.allowed());
        verifyNoInteractions(store);
    }

    @Test
    void personalGoal_otherUser_isPermissionDenied() {
        PermissionDecision decision = gate.canAccess(userId, personalGoal(UUID.randomUUID()));

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.PERMISSION, decision.errorType());
        assertFalse(decision.suggestedActions().isEmpty());
    }

    @Test
    void familyGoal_creator_isAdmin() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));

        PermissionDecision decision = gate.canAccess(family.getCreatedBy(), familyGoal());

        assertTrue(decision.allowed());
        assertEquals(FamilyRole.ADMIN, decision.role());
    }

    @Test
    void familyGoal_activeMember_isAllowed() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));
        when(store.getFamilyMembership(familyId, userId))
                .thenReturn(Optional.of(member(FamilyRole.MEMBER, MembershipStatus.ACTIVE, true)));

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertTrue(decision.allowed());
        assertEquals(FamilyRole.MEMBER, decision.role());
    }

    @Test
    void familyGoal_viewer_isFamilyRestriction() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));
        when(store.getFamilyMembership(familyId, userId))
                .thenReturn(Optional.of(member(FamilyRole.VIEWER, MembershipStatus.ACTIVE, true)));

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.FAMILY_RESTRICTION, decision.errorType());
        assertEquals(FamilyRole.VIEWER, decision.role());
    }

    @Test
    void familyGoal_memberWithContributionsDisabled_isFamilyRestriction() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));
        when(store.getFamilyMembership(familyId, userId))
                .thenReturn(Optional.of(member(FamilyRole.MEMBER, MembershipStatus.ACTIVE, false)));

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.FAMILY_RESTRICTION, decision.errorType());
    }

    @Test
    void familyGoal_inactiveMember_isPermissionDenied() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));
        when(store.getFamilyMembership(familyId, userId))
                .thenReturn(Optional.of(member(FamilyRole.ADMIN, MembershipStatus.PENDING, true)));

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.PERMISSION, decision.errorType());
    }

    @Test
    void familyGoal_notMember_isPermissionDenied() {
        when(store.getFamily(familyId)).thenReturn(Optional.of(family));
        when(store.getFamilyMembership(familyId, userId)).thenReturn(Optional.empty());

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.PERMISSION, decision.errorType());
    }

    @Test
    void familyGoal_storeFailure_isNetworkDenial() {
        when(store.getFamily(familyId)).thenThrow(new StoreException("timeout"));

        PermissionDecision decision = gate.canAccess(userId, familyGoal());

        assertFalse(decision.allowed());
        assertEquals(ContributionErrorType.NETWORK, decision.errorType());
    }
}
