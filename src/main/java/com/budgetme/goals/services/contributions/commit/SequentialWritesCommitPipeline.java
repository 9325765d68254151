package com.budgetme.goals.services.contributions.commit;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.ContributionErrorType;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.store.DuplicateContributionException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Caminho alternativo, sem atomicidade entre tabelas. Três escritas em ordem fixa:
 * 1. Registro da contribuição (+ lançamento)
 * 2. Saldo da conta
 * 3. Progresso e status da meta
 * <p>
 * Se 2 ou 3 falharem depois de 1, o resultado é PARTIALLY_COMMITTED com os
 * passos concluídos. Não há compensação automática.
 * <p>
 * Uma chave de idempotência já gravada significa que uma tentativa anterior
 * chegou ao passo 1, mas não se sabe se aplicou os passos 2 e 3. Nada é
 * escrito de novo e o resultado também é PARTIALLY_COMMITTED, para conciliação.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequentialWritesCommitPipeline implements CommitPipeline {

    private static final CommitStrategy STRATEGY = CommitStrategy.SEQUENTIAL_WRITES;

    static final String ALREADY_RECORDED =
            "Contribuição já registrada por uma tentativa anterior; efeitos em saldo e meta não confirmados";

    private final ContributionStore store;

    @Override
    public CommitResult commit(ContributionCommand command) {
        Goal goal;
        Account account;
        try {
            if (command.idempotencyKey() != null) {
                Optional<GoalContribution> previous = store.findContributionByIdempotencyKey(command.idempotencyKey());
                if (previous.isPresent()) {
                    return alreadyRecorded(command, previous.get());
                }
            }
            Optional<Goal> freshGoal = store.getGoal(command.goalId());
            Optional<Account> freshAccount = store.getAccount(command.accountId());
            if (freshGoal.isEmpty()) {
                return CommitResult.rejected(STRATEGY, ContributionErrorType.VALIDATION, "Meta não encontrada");
            }
            if (freshAccount.isEmpty()) {
                return CommitResult.rejected(STRATEGY, ContributionErrorType.VALIDATION, "Conta não encontrada");
            }
            goal = freshGoal.get();
            account = freshAccount.get();
        } catch (RuntimeException e) {
            log.warn("[ContributionCommit] Falha ao reler meta/conta antes das escritas: {}", e.getMessage());
            return CommitResult.notCommitted(STRATEGY, null, e.getMessage());
        }

        BigDecimal amount = command.amount();
        if (!goal.getStatus().acceptsContributions()) {
            return CommitResult.rejected(STRATEGY, ContributionErrorType.VALIDATION,
                    "A meta não aceita mais contribuições");
        }
        if (account.getBalance().compareTo(amount) < 0) {
            return CommitResult.rejected(STRATEGY, ContributionErrorType.BALANCE, "Saldo insuficiente");
        }
        if (amount.compareTo(goal.remainingAmount()) > 0) {
            return CommitResult.rejected(STRATEGY, ContributionErrorType.GOAL_LIMIT,
                    "Valor excede o restante da meta");
        }

        List<CommitStep> completed = new ArrayList<>();

        GoalContribution contribution;
        try {
            contribution = store.insertContribution(command);
            completed.add(CommitStep.LEDGER_ENTRY);
        } catch (DuplicateContributionException e) {
            return alreadyRecorded(command, lookupPrevious(e.getIdempotencyKey()));
        } catch (RuntimeException e) {
            log.warn("[ContributionCommit] Falha ao gravar contribuição: {}", e.getMessage());
            return CommitResult.notCommitted(STRATEGY, CommitStep.LEDGER_ENTRY, e.getMessage());
        }

        try {
            store.updateAccountBalance(account.getId(), account.getBalance().subtract(amount));
            completed.add(CommitStep.ACCOUNT_BALANCE);
        } catch (RuntimeException e) {
            return CommitResult.partiallyCommitted(STRATEGY, contribution.getId(), contribution.getTransactionId(),
                    completed, CommitStep.ACCOUNT_BALANCE, e.getMessage());
        }

        BigDecimal newAmount = goal.getCurrentAmount().add(amount);
        try {
            store.updateGoal(goal.getId(), newAmount, GoalStatus.forProgress(newAmount, goal.getTargetAmount()));
            completed.add(CommitStep.GOAL_PROGRESS);
        } catch (RuntimeException e) {
            return CommitResult.partiallyCommitted(STRATEGY, contribution.getId(), contribution.getTransactionId(),
                    completed, CommitStep.GOAL_PROGRESS, e.getMessage());
        }

        log.info("[ContributionCommit] Escritas avulsas concluídas: contribuição={} meta={} novoTotal={}",
                contribution.getId(), goal.getId(), newAmount);
        return CommitResult.fullyCommitted(STRATEGY, contribution.getId(), contribution.getTransactionId());
    }

    private CommitResult alreadyRecorded(ContributionCommand command, GoalContribution previous) {
        UUID contributionId = previous != null ? previous.getId() : null;
        UUID transactionId = previous != null ? previous.getTransactionId() : null;
        log.error("[ContributionCommit] Chave {} já registrada (contribuição={}); saldo e meta não confirmados",
                command.idempotencyKey(), contributionId);
        return CommitResult.partiallyCommitted(STRATEGY, contributionId, transactionId,
                List.of(CommitStep.LEDGER_ENTRY), CommitStep.ACCOUNT_BALANCE, ALREADY_RECORDED);
    }

    // corrida com outra tentativa: a chave apareceu entre a checagem e o insert
    private GoalContribution lookupPrevious(UUID idempotencyKey) {
        try {
            return store.findContributionByIdempotencyKey(idempotencyKey).orElse(null);
        } catch (RuntimeException e) {
            log.warn("[ContributionCommit] Falha ao buscar contribuição da chave {}: {}", idempotencyKey, e.getMessage());
            return null;
        }
    }
}
