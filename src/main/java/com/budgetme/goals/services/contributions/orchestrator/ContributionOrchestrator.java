package com.budgetme.goals.services.contributions.orchestrator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.budgetme.goals.dto.contribution.AccountOptionDTO;
import com.budgetme.goals.dto.contribution.ContributionPreviewDTO;
import com.budgetme.goals.dto.contribution.ContributionSessionDTO;
import com.budgetme.goals.dto.contribution.GoalOptionDTO;
import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.ContributionType;
import com.budgetme.goals.exceptions.ConflictException;
import com.budgetme.goals.mappers.GoalContributionMapper;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.ContributionDraft;
import com.budgetme.goals.services.contributions.ContributionError;
import com.budgetme.goals.services.contributions.ContributionErrors;
import com.budgetme.goals.services.contributions.ContributionStep;
import com.budgetme.goals.services.contributions.GoalProgressUtils;
import com.budgetme.goals.services.contributions.commit.CommitOutcome;
import com.budgetme.goals.services.contributions.commit.CommitPipeline;
import com.budgetme.goals.services.contributions.commit.CommitResult;
import com.budgetme.goals.services.contributions.permission.GoalPermissionGate;
import com.budgetme.goals.services.contributions.permission.PermissionDecision;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.sync.GoalRealtimeSyncManager;
import com.budgetme.goals.services.contributions.validation.ContributionValidator;
import com.budgetme.goals.services.contributions.validation.ValidationOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Conduz o usuário pelo fluxo de contribuição, delegando permissão,
 * validação e commit aos componentes especializados.
 * <p>
 * Operações de navegação são serializadas pelo monitor da sessão. O commit roda
 * fora dele, protegido pela flag de commit em andamento da sessão.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionOrchestrator {

    private final ContributionSessionRegistry registry;
    private final ContributionStore store;
    private final GoalPermissionGate permissionGate;
    private final ContributionValidator validator;
    private final CommitPipeline commitPipeline;
    private final GoalRealtimeSyncManager syncManager;

    public ContributionSessionDTO open(UUID userId) {
        ContributionSession session = registry.create(userId);
        log.debug("[ContributionFlow] Sessão {} aberta para {}", session.getId(), userId);
        return view(session);
    }

    public ContributionSessionDTO view(UUID userId, UUID sessionId) {
        return view(registry.get(userId, sessionId));
    }

    public ContributionSessionDTO selectGoal(UUID userId, UUID sessionId, UUID goalId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            session.requireStep(ContributionStep.SELECTION);
            applyGoalSelection(session, goalId);
        }
        return view(session);
    }

    public ContributionSessionDTO setAmount(UUID userId, UUID sessionId, String amount) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            session.requireStep(ContributionStep.CONTRIBUTION);
            session.getDraft().setAmount(amount);
            session.setError(null);
        }
        return view(session);
    }

    public ContributionSessionDTO setAccount(UUID userId, UUID sessionId, UUID accountId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            session.requireStep(ContributionStep.CONTRIBUTION);
            session.getDraft().setAccountId(accountId);
            session.setError(null);
        }
        return view(session);
    }

    public ContributionSessionDTO setNotes(UUID userId, UUID sessionId, String notes) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            session.requireStep(ContributionStep.CONTRIBUTION);
            session.getDraft().setNotes(notes);
        }
        return view(session);
    }

    public ContributionSessionDTO proceed(UUID userId, UUID sessionId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            ContributionDraft draft = session.getDraft();
            switch (draft.getStep()) {
                case SELECTION -> {
                    if (draft.getGoalId() == null) {
                        session.setError(ContributionErrors.validation(false, "Selecione uma meta para continuar"));
                    } else {
                        applyGoalSelection(session, draft.getGoalId());
                    }
                }
                case CONTRIBUTION -> {
                    Goal goal = store.getGoal(draft.getGoalId()).orElse(null);
                    Account account = resolveAccount(userId, draft.getAccountId());
                    ValidationOutcome outcome = validator.validate(draft, goal, account);
                    if (outcome.valid()) {
                        session.setError(null);
                        session.moveTo(ContributionStep.REVIEW);
                    } else {
                        session.setError(outcome.error());
                    }
                }
                default -> throw new ConflictException("Não há próxima etapa a partir de " + draft.getStep().code());
            }
        }
        return view(session);
    }

    public ContributionSessionDTO back(UUID userId, UUID sessionId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            session.requireIdle();
            ContributionStep current = session.getStep();
            if (current == ContributionStep.REVIEW) {
                session.moveTo(ContributionStep.CONTRIBUTION);
            } else if (current == ContributionStep.CONTRIBUTION) {
                session.moveTo(ContributionStep.SELECTION);
            } else {
                throw new ConflictException("Não há etapa anterior a " + current.code());
            }
            session.setError(null);
        }
        return view(session);
    }

    /**
     * Relê meta e conta, revalida e só então envia ao pipeline de commit.
     * Depois de iniciado, o commit não pode ser cancelado.
     */
    public ContributionSessionDTO confirm(UUID userId, UUID sessionId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            if (session.isClosed()) {
                throw new ConflictException("Fluxo de contribuição encerrado");
            }
            session.requireStep(ContributionStep.REVIEW);
            if (!session.beginCommit()) {
                throw new ConflictException("Contribuição em processamento, aguarde");
            }
        }

        ContributionDraft draft = session.getDraft();
        Goal goal = null;
        CommitResult result = null;
        try {
            goal = store.getGoal(draft.getGoalId()).orElse(null);
            Account account = resolveAccount(userId, draft.getAccountId());

            PermissionDecision decision = goal != null ? permissionGate.canAccess(userId, goal) : null;
            ValidationOutcome outcome = validator.validate(draft, goal, account);

            if (decision != null && !decision.allowed()) {
                returnToContribution(session, ContributionErrors.denied(goal.isFamilyGoal(), decision));
            } else if (!outcome.valid()) {
                returnToContribution(session, outcome.error());
            } else {
                ContributionCommand command = new ContributionCommand(
                        goal.getId(),
                        account.getId(),
                        userId,
                        outcome.amount(),
                        draft.getNotes(),
                        ContributionType.MANUAL,
                        draft.getIdempotencyKey(),
                        goal.getGoalName(),
                        account.getAccountName()
                );
                result = commitPipeline.commit(command);
                applyCommitResult(session, goal, result);
            }
        } catch (RuntimeException e) {
            log.warn("[ContributionFlow] Falha no confirm da sessão {}: {}", sessionId, e.getMessage());
            returnToContribution(session, ContributionErrors.network(goal != null && goal.isFamilyGoal(), e.getMessage()));
        } finally {
            session.endCommit();
        }

        if (result != null) {
            if (result.isSuccess()) {
                signalSuccess(session, goal, result);
            }
            if (result.isSuccess() || result.outcome() == CommitOutcome.PARTIALLY_COMMITTED) {
                syncManager.refresh(goal.getId());
            }
        }
        return view(session);
    }

    public ContributionSessionDTO cancel(UUID userId, UUID sessionId) {
        ContributionSession session = registry.get(userId, sessionId);
        synchronized (session) {
            if (session.isBusy()) {
                throw new ConflictException("Contribuição em processamento, não é possível cancelar");
            }
            if (!session.isClosed()) {
                session.moveTo(ContributionStep.CLOSED);
            }
            registry.remove(sessionId);
        }
        log.debug("[ContributionFlow] Sessão {} cancelada", sessionId);
        return view(session);
    }

    public void onContributionSuccess(UUID userId, UUID sessionId, ContributionSuccessListener listener) {
        registry.get(userId, sessionId).addSuccessListener(listener);
    }

    /**
     * Metas que podem receber contribuição do usuário agora.
     */
    public List<Goal> eligibleGoals(UUID userId) {
        return store.getGoalsVisibleTo(userId).stream()
                .filter(goal -> goal.getStatus().acceptsContributions())
                .filter(goal -> goal.remainingAmount().signum() > 0)
                .filter(goal -> !goal.isFamilyGoal() || permissionGate.canAccess(userId, goal).allowed())
                .toList();
    }

    private void applyGoalSelection(ContributionSession session, UUID goalId) {
        Optional<Goal> found = store.getGoal(goalId);
        if (found.isEmpty()) {
            session.setError(ContributionErrors.validation(false, "Meta não encontrada"));
            return;
        }
        Goal goal = found.get();

        PermissionDecision decision = permissionGate.canAccess(session.getUserId(), goal);
        if (!decision.allowed()) {
            log.info("[ContributionFlow] Seleção da meta {} negada para {}: {}",
                    goalId, session.getUserId(), decision.errorType());
            session.setError(ContributionErrors.denied(goal.isFamilyGoal(), decision));
            return;
        }

        if (!goal.getStatus().acceptsContributions() || goal.remainingAmount().signum() <= 0) {
            session.setError(ContributionErrors.validation(goal.isFamilyGoal(),
                    "Esta meta não está aceitando contribuições"));
            return;
        }

        ContributionDraft draft = session.getDraft();
        if (!goalId.equals(draft.getGoalId()) || draft.getNotes() == null || draft.getNotes().isBlank()) {
            draft.setNotes("Contribuição para " + goal.getGoalName());
        }
        draft.setGoalId(goalId);
        session.setError(null);
        session.moveTo(ContributionStep.CONTRIBUTION);
    }

    private void returnToContribution(ContributionSession session, ContributionError error) {
        synchronized (session) {
            session.setError(error);
            session.moveTo(ContributionStep.CONTRIBUTION);
        }
    }

    private void applyCommitResult(ContributionSession session, Goal goal, CommitResult result) {
        boolean family = goal.isFamilyGoal();
        switch (result.outcome()) {
            case FULLY_COMMITTED -> {
                synchronized (session) {
                    session.setContributionId(result.contributionId());
                    session.setError(null);
                    session.moveTo(ContributionStep.CLOSED);
                }
                log.info("[ContributionFlow] Contribuição {} concluída na sessão {}", result.contributionId(), session.getId());
            }
            case PARTIALLY_COMMITTED -> {
                // fecha a sessão para o mesmo rascunho não ser reenviado às cegas
                synchronized (session) {
                    session.setContributionId(result.contributionId());
                    session.setError(ContributionErrors.incompleteCommit(family, result));
                    session.moveTo(ContributionStep.CLOSED);
                }
            }
            case REJECTED -> returnToContribution(session, ContributionErrors.rejected(family, result));
            default -> returnToContribution(session, ContributionErrors.network(family, result.reason()));
        }
    }

    private void signalSuccess(ContributionSession session, Goal goal, CommitResult result) {
        ContributionDraft draft = session.getDraft();
        ContributionSuccess success = new ContributionSuccess(
                session.getId(),
                session.getUserId(),
                goal.getId(),
                draft.getAccountId(),
                result.contributionId(),
                ContributionValidator.parseAmount(draft.getAmount())
        );
        for (ContributionSuccessListener listener : session.getSuccessListeners()) {
            try {
                listener.onContributionSuccess(success);
            } catch (Exception e) {
                log.warn("[ContributionFlow] Listener de sucesso falhou na sessão {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    // conta só é considerada se pertence ao usuário
    private Account resolveAccount(UUID userId, UUID accountId) {
        if (accountId == null) {
            return null;
        }
        return store.getAccount(accountId)
                .filter(account -> account.getUserId().equals(userId))
                .orElse(null);
    }

    private ContributionSessionDTO view(ContributionSession session) {
        ContributionDraft draft;
        synchronized (session) {
            draft = session.getDraft().copy();
        }
        UUID userId = session.getUserId();

        List<GoalOptionDTO> goals = null;
        List<AccountOptionDTO> accounts = null;
        ContributionPreviewDTO preview = null;

        if (!session.isBusy()) {
            switch (draft.getStep()) {
                case SELECTION -> {
                    LocalDate today = LocalDate.now();
                    goals = eligibleGoals(userId).stream()
                            .map(goal -> GoalContributionMapper.toGoalOption(goal, today))
                            .toList();
                }
                case CONTRIBUTION -> accounts = store.getAccountsForUser(userId).stream()
                        .map(GoalContributionMapper::toAccountOption)
                        .toList();
                case REVIEW -> {
                    accounts = store.getAccountsForUser(userId).stream()
                            .map(GoalContributionMapper::toAccountOption)
                            .toList();
                    preview = preview(userId, draft);
                }
                default -> {
                }
            }
        }

        return new ContributionSessionDTO(
                session.getId().toString(),
                draft.getStep(),
                session.isBusy(),
                draft.getGoalId() != null ? draft.getGoalId().toString() : null,
                draft.getAccountId() != null ? draft.getAccountId().toString() : null,
                draft.getAmount(),
                draft.getNotes(),
                goals,
                accounts,
                preview,
                session.getError(),
                session.getContributionId() != null ? session.getContributionId().toString() : null
        );
    }

    private ContributionPreviewDTO preview(UUID userId, ContributionDraft draft) {
        Goal goal = store.getGoal(draft.getGoalId()).orElse(null);
        Account account = resolveAccount(userId, draft.getAccountId());
        ValidationOutcome outcome = validator.validate(draft, goal, account);
        if (!outcome.valid()) {
            // dados mudaram desde a validação; o confirm vai acusar
            return null;
        }
        BigDecimal amount = outcome.amount();
        BigDecimal newAmount = goal.getCurrentAmount().add(amount);
        BigDecimal newPercentage = GoalProgressUtils.percentage(newAmount, goal.getTargetAmount());
        BigDecimal remainingAfter = goal.getTargetAmount().subtract(newAmount).max(BigDecimal.ZERO);
        return new ContributionPreviewDTO(
                amount,
                goal.getCurrentAmount(),
                newAmount,
                goal.getTargetAmount(),
                newPercentage,
                remainingAfter,
                newAmount.compareTo(goal.getTargetAmount()) >= 0,
                GoalProgressUtils.completionMessage(newPercentage),
                account.getBalance().subtract(amount)
        );
    }
}
