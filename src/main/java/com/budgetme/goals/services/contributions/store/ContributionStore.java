package com.budgetme.goals.services.contributions.store;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Family;
import com.budgetme.goals.entities.FamilyMember;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.services.contributions.ContributionCommand;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Acesso a dados usado pelo fluxo de contribuição.
 * <p>
 * Cada escrita é atômica sozinha; só {@link #callAtomicContributeProcedure}
 * aplica os três efeitos de uma contribuição numa única transação.
 * Falhas de infraestrutura são lançadas como
 * {@link com.budgetme.goals.exceptions.StoreException}.
 */
public interface ContributionStore {

    Optional<Goal> getGoal(UUID id);

    /** Metas próprias (pessoais) mais as metas das famílias em que o usuário está ativo. */
    List<Goal> getGoalsVisibleTo(UUID userId);

    List<Account> getAccountsForUser(UUID userId);

    Optional<Account> getAccount(UUID id);

    Optional<Family> getFamily(UUID familyId);

    Optional<FamilyMember> getFamilyMembership(UUID familyId, UUID userId);

    List<GoalContribution> getContributionsForGoal(UUID goalId);

    Optional<GoalContribution> findContributionByIdempotencyKey(UUID idempotencyKey);

    /**
     * Grava o registro da contribuição junto com o lançamento em
     * {@code financial_transactions} (mesma transação local).
     *
     * @throws DuplicateContributionException se a chave de idempotência já existe
     */
    GoalContribution insertContribution(ContributionCommand command);

    void updateAccountBalance(UUID accountId, BigDecimal newBalance);

    void updateGoal(UUID goalId, BigDecimal newCurrentAmount, GoalStatus newStatus);

    ProcedureResult callAtomicContributeProcedure(ContributionCommand command);

    StoreSubscription subscribeToChanges(ChangeTable table, ChangeFilter filter, Consumer<RecordChange> onChange);

    void unsubscribe(StoreSubscription subscription);
}
