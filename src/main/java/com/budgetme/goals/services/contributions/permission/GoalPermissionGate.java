package com.budgetme.goals.services.contributions.permission;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.budgetme.goals.entities.Family;
import com.budgetme.goals.entities.FamilyMember;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.FamilyRole;
import com.budgetme.goals.services.contributions.ContributionErrorType;
import com.budgetme.goals.services.contributions.store.ContributionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ponto único de decisão sobre quem pode contribuir para uma meta.
 * <ul>
 *   <li>Meta pessoal: só o dono.</li>
 *   <li>Meta familiar: membro ativo cujo papel dá direito de contribuir e que
 *       não teve a contribuição bloqueada individualmente. O criador da família
 *       sempre conta como admin.</li>
 * </ul>
 * Somente leitura.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoalPermissionGate {

    private final ContributionStore store;

    public PermissionDecision canAccess(UUID userId, Goal goal) {
        if (!goal.isFamilyGoal()) {
            if (goal.getUserId().equals(userId)) {
                return PermissionDecision.allow(null);
            }
            return PermissionDecision.deny(
                    ContributionErrorType.PERMISSION,
                    "Você só pode contribuir para as suas próprias metas pessoais.",
                    List.of("Verifique se está conectado com a conta correta"),
                    null
            );
        }

        try {
            return resolveFamilyAccess(userId, goal);
        } catch (RuntimeException e) {
            log.warn("[PermissionGate] Falha ao resolver permissões da família {} para {}: {}",
                    goal.getFamilyId(), userId, e.getMessage());
            return PermissionDecision.deny(
                    ContributionErrorType.NETWORK,
                    "Não foi possível verificar suas permissões na família agora.",
                    List.of("Tente novamente em instantes"),
                    null
            );
        }
    }

    private PermissionDecision resolveFamilyAccess(UUID userId, Goal goal) {
        Optional<Family> family = store.getFamily(goal.getFamilyId());
        if (family.isPresent() && userId.equals(family.get().getCreatedBy())) {
            return PermissionDecision.allow(FamilyRole.ADMIN);
        }

        Optional<FamilyMember> membership = store.getFamilyMembership(goal.getFamilyId(), userId);
        if (membership.isEmpty() || !membership.get().isActive()) {
            log.debug("[PermissionGate] Usuário {} não é membro ativo da família {}", userId, goal.getFamilyId());
            return PermissionDecision.deny(
                    ContributionErrorType.PERMISSION,
                    "Você não é membro ativo da família dona desta meta.",
                    List.of(
                            "Peça a um administrador da família para enviar um convite",
                            "Aceite o convite pendente, se houver"
                    ),
                    null
            );
        }

        FamilyMember member = membership.get();
        FamilyRole role = member.getRole();
        if (!role.hasContributionRights()) {
            return PermissionDecision.deny(
                    ContributionErrorType.FAMILY_RESTRICTION,
                    "Como visualizador da família, você não pode contribuir para metas familiares.",
                    List.of(
                            "Peça a um administrador da família para alterar o seu papel",
                            "Contribua para uma meta pessoal"
                    ),
                    role
            );
        }
        if (!member.isCanContributeGoals()) {
            return PermissionDecision.deny(
                    ContributionErrorType.FAMILY_RESTRICTION,
                    "Suas contribuições para metas familiares foram desativadas por um administrador.",
                    List.of("Fale com o administrador da família para liberar contribuições"),
                    role
            );
        }

        return PermissionDecision.allow(role);
    }
}
