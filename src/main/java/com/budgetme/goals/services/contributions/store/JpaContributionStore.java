package com.budgetme.goals.services.contributions.store;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import com.budgetme.goals.config.ContributionProperties;
import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Family;
import com.budgetme.goals.entities.FamilyMember;
import com.budgetme.goals.entities.FinancialTransaction;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.enums.MembershipStatus;
import com.budgetme.goals.exceptions.StoreException;
import com.budgetme.goals.repositories.AccountRepository;
import com.budgetme.goals.repositories.FamilyMemberRepository;
import com.budgetme.goals.repositories.FamilyRepository;
import com.budgetme.goals.repositories.FinancialTransactionRepository;
import com.budgetme.goals.repositories.GoalContributionRepository;
import com.budgetme.goals.repositories.GoalRepository;
import com.budgetme.goals.services.contributions.ContributionCommand;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaContributionStore implements ContributionStore {

    private final GoalRepository goalRepository;
    private final AccountRepository accountRepository;
    private final FamilyRepository familyRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final GoalContributionRepository contributionRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final AtomicContributionProcedure atomicProcedure;
    private final RealtimeChangeFeed changeFeed;
    private final ApplicationEventPublisher eventPublisher;
    private final ContributionProperties properties;

    @Override
    @Transactional(readOnly = true)
    public Optional<Goal> getGoal(UUID id) {
        try {
            return goalRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao ler meta " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Goal> getGoalsVisibleTo(UUID userId) {
        try {
            List<Goal> goals = new ArrayList<>(goalRepository.findByUserIdAndFamilyIdIsNull(userId));
            List<UUID> familyIds = familyMemberRepository.findByUserIdAndStatus(userId, MembershipStatus.ACTIVE)
                    .stream()
                    .map(FamilyMember::getFamilyId)
                    .toList();
            if (!familyIds.isEmpty()) {
                goals.addAll(goalRepository.findByFamilyIdIn(familyIds));
            }
            return goals;
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao listar metas do usuário " + userId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> getAccountsForUser(UUID userId) {
        try {
            return accountRepository.findByUserIdOrderByAccountNameAsc(userId);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao listar contas do usuário " + userId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getAccount(UUID id) {
        try {
            return accountRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao ler conta " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Family> getFamily(UUID familyId) {
        try {
            return familyRepository.findById(familyId);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao ler família " + familyId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FamilyMember> getFamilyMembership(UUID familyId, UUID userId) {
        try {
            return familyMemberRepository.findByFamilyIdAndUserId(familyId, userId);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao ler vínculo familiar", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<GoalContribution> getContributionsForGoal(UUID goalId) {
        try {
            return contributionRepository.findByGoalIdOrderByCreatedAtDesc(goalId);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao listar contribuições da meta " + goalId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GoalContribution> findContributionByIdempotencyKey(UUID idempotencyKey) {
        try {
            return contributionRepository.findByIdempotencyKey(idempotencyKey);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao buscar contribuição pela chave " + idempotencyKey, e);
        }
    }

    @Override
    @Transactional
    public GoalContribution insertContribution(ContributionCommand command) {
        try {
            if (command.idempotencyKey() != null
                    && contributionRepository.existsByIdempotencyKey(command.idempotencyKey())) {
                throw new DuplicateContributionException(command.idempotencyKey());
            }

            UUID familyId = goalRepository.findById(command.goalId())
                    .map(Goal::getFamilyId)
                    .orElse(null);

            LocalDate today = LocalDate.now();
            FinancialTransaction tx = transactionRepository.saveAndFlush(
                    ContributionRecords.ledgerEntry(command, familyId, today));
            GoalContribution saved = contributionRepository.saveAndFlush(
                    ContributionRecords.contribution(command, tx.getId(), today));

            eventPublisher.publishEvent(ContributionRecords.inserted(tx));
            eventPublisher.publishEvent(ContributionRecords.inserted(saved));
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (command.idempotencyKey() != null && isIdempotencyViolation(e)) {
                throw new DuplicateContributionException(command.idempotencyKey());
            }
            throw new StoreException("Falha ao gravar contribuição", e);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao gravar contribuição", e);
        }
    }

    @Override
    @Transactional
    public void updateAccountBalance(UUID accountId, BigDecimal newBalance) {
        try {
            Account account = accountRepository.findById(accountId)
                    .orElseThrow(() -> new StoreException("Conta não encontrada: " + accountId));
            account.setBalance(newBalance);
            accountRepository.saveAndFlush(account);
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao atualizar saldo da conta " + accountId, e);
        }
    }

    @Override
    @Transactional
    public void updateGoal(UUID goalId, BigDecimal newCurrentAmount, GoalStatus newStatus) {
        try {
            Goal goal = goalRepository.findById(goalId)
                    .orElseThrow(() -> new StoreException("Meta não encontrada: " + goalId));
            goal.setCurrentAmount(newCurrentAmount);
            goal.setStatus(newStatus);
            Goal saved = goalRepository.saveAndFlush(goal);
            eventPublisher.publishEvent(ContributionRecords.updated(saved));
        } catch (DataAccessException e) {
            throw new StoreException("Falha ao atualizar meta " + goalId, e);
        }
    }

    @Override
    public ProcedureResult callAtomicContributeProcedure(ContributionCommand command) {
        if (!properties.atomicProcedureEnabled()) {
            return ProcedureResult.unavailable();
        }
        try {
            return atomicProcedure.execute(command);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Falha no procedimento atômico de contribuição", e);
        }
    }

    @Override
    public StoreSubscription subscribeToChanges(ChangeTable table, ChangeFilter filter, Consumer<RecordChange> onChange) {
        return changeFeed.subscribe(table, filter, onChange);
    }

    @Override
    public void unsubscribe(StoreSubscription subscription) {
        changeFeed.unsubscribe(subscription);
    }

    private boolean isIdempotencyViolation(DataIntegrityViolationException e) {
        String msg = e.getMostSpecificCause().getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("idempotency");
    }
}
