package com.budgetme.goals.security;

import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component("securityService")
@RequiredArgsConstructor
public class SecurityService {

    private final ContributionStore store;

    /**
     * Id do usuário autenticado. Aceita o principal montado pelo filtro JWT ou
     * qualquer autenticação cujo nome seja um UUID.
     */
    public UUID getCurrentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth == null || !auth.isAuthenticated()) {
            throw new AuthenticationCredentialsNotFoundException("Usuário não autenticado");
        }

        if (auth.getPrincipal() instanceof CustomUserDetails details) {
            return details.getId();
        }

        try {
            return UUID.fromString(auth.getName());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationCredentialsNotFoundException("Identificador de usuário inválido no token");
        }
    }

    // =========================
    // Goal
    // =========================

    /**
     * Leitura da meta: dono de meta pessoal, ou criador/membro ativo (qualquer
     * papel) da família dona da meta. Contribuir é decidido pelo GoalPermissionGate.
     */
    public boolean canViewGoal(String goalId) {
        UUID userId = getCurrentUserId();
        UUID id;
        try {
            id = UUID.fromString(goalId);
        } catch (IllegalArgumentException e) {
            return false;
        }

        return store.getGoal(id)
                .map(goal -> canView(userId, goal))
                .orElse(false);
    }

    private boolean canView(UUID userId, Goal goal) {
        if (!goal.isFamilyGoal()) {
            return goal.getUserId().equals(userId);
        }
        boolean creator = store.getFamily(goal.getFamilyId())
                .map(family -> userId.equals(family.getCreatedBy()))
                .orElse(false);
        return creator || store.getFamilyMembership(goal.getFamilyId(), userId)
                .map(member -> member.isActive())
                .orElse(false);
    }
}
