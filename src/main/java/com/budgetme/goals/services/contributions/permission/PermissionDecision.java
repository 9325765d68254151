package com.budgetme.goals.services.contributions.permission;

import com.budgetme.goals.enums.FamilyRole;
import com.budgetme.goals.services.contributions.ContributionErrorType;

import java.util.List;

/**
 * Resposta do {@link GoalPermissionGate}. Negações trazem motivo e sugestões
 * como dados; quem decide o que exibir é o orquestrador.
 */
public record PermissionDecision(
        boolean allowed,
        String reason,
        List<String> suggestedActions,
        ContributionErrorType errorType,
        FamilyRole role
) {
    public PermissionDecision {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }

    public static PermissionDecision allow(FamilyRole role) {
        return new PermissionDecision(true, null, List.of(), null, role);
    }

    public static PermissionDecision deny(ContributionErrorType type, String reason, List<String> actions, FamilyRole role) {
        return new PermissionDecision(false, reason, actions, type, role);
    }
}
