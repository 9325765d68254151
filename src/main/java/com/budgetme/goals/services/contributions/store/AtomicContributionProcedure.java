package com.budgetme.goals.services.contributions.store;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.FinancialTransaction;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.repositories.AccountRepository;
import com.budgetme.goals.repositories.FinancialTransactionRepository;
import com.budgetme.goals.repositories.GoalContributionRepository;
import com.budgetme.goals.repositories.GoalRepository;
import com.budgetme.goals.services.contributions.ContributionCommand;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Aplica uma contribuição inteira numa única transação:
 * 1. Trava a meta e a conta (PESSIMISTIC_WRITE, sempre nessa ordem)
 * 2. Revalida existência, titularidade da conta, saldo e restante da meta
 * 3. Grava lançamento + contribuição
 * 4. Debita a conta e credita a meta, recalculando o status
 * <p>
 * As travas fazem a checagem de saldo valer contra o valor real, mesmo com
 * dois dispositivos contribuindo ao mesmo tempo.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AtomicContributionProcedure {

    private final GoalRepository goalRepository;
    private final AccountRepository accountRepository;
    private final GoalContributionRepository contributionRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public ProcedureResult execute(ContributionCommand command) {
        if (command.idempotencyKey() != null) {
            Optional<GoalContribution> existing = contributionRepository.findByIdempotencyKey(command.idempotencyKey());
            if (existing.isPresent()) {
                log.info("[AtomicContribution] Chave {} já aplicada, devolvendo contribuição {}",
                        command.idempotencyKey(), existing.get().getId());
                return ProcedureResult.replayed(existing.get().getId(), existing.get().getTransactionId());
            }
        }

        Optional<Goal> lockedGoal = goalRepository.findByIdForUpdate(command.goalId());
        if (lockedGoal.isEmpty()) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.GOAL_NOT_FOUND);
        }
        Goal goal = lockedGoal.get();
        if (!goal.getStatus().acceptsContributions()) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.GOAL_NOT_ACCEPTING);
        }

        Optional<Account> lockedAccount = accountRepository.findByIdForUpdate(command.accountId());
        if (lockedAccount.isEmpty()) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.ACCOUNT_NOT_FOUND);
        }
        Account account = lockedAccount.get();
        if (!account.getUserId().equals(command.userId())) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.ACCOUNT_NOT_OWNED);
        }

        BigDecimal amount = command.amount();
        if (account.getBalance().compareTo(amount) < 0) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.INSUFFICIENT_FUNDS);
        }
        if (amount.compareTo(goal.remainingAmount()) > 0) {
            return ProcedureResult.rejected(ProcedureResult.Rejection.GOAL_LIMIT_EXCEEDED);
        }

        LocalDate today = LocalDate.now();
        FinancialTransaction tx = transactionRepository.save(
                ContributionRecords.ledgerEntry(command, goal.getFamilyId(), today));
        GoalContribution contribution = contributionRepository.save(
                ContributionRecords.contribution(command, tx.getId(), today));

        account.setBalance(account.getBalance().subtract(amount));

        BigDecimal newAmount = goal.getCurrentAmount().add(amount);
        goal.setCurrentAmount(newAmount);
        goal.setStatus(GoalStatus.forProgress(newAmount, goal.getTargetAmount()));

        eventPublisher.publishEvent(ContributionRecords.inserted(tx));
        eventPublisher.publishEvent(ContributionRecords.inserted(contribution));
        eventPublisher.publishEvent(ContributionRecords.updated(goal));

        log.info("[AtomicContribution] Contribuição {} aplicada: meta={} conta={} valor={} novoTotal={} status={}",
                contribution.getId(), goal.getId(), account.getId(), amount, newAmount, goal.getStatus());

        return ProcedureResult.ok(contribution.getId(), tx.getId());
    }
}
