package com.budgetme.goals.services.contributions.store;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.budgetme.goals.entities.FinancialTransaction;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.enums.TransactionType;
import com.budgetme.goals.services.contributions.ContributionCommand;

/**
 * Montagem dos registros gravados por uma contribuição e das notificações
 * correspondentes. Compartilhado pelo procedimento atômico e pelas escritas avulsas.
 */
final class ContributionRecords {

    static final String LEDGER_CATEGORY = "Contribuição para meta";

    private ContributionRecords() {
    }

    static FinancialTransaction ledgerEntry(ContributionCommand command, UUID familyId, LocalDate today) {
        return FinancialTransaction.builder()
                .userId(command.userId())
                .accountId(command.accountId())
                .goalId(command.goalId())
                .familyId(familyId)
                .amount(command.amount())
                .type(TransactionType.CONTRIBUTION)
                .category(LEDGER_CATEGORY)
                .notes(command.notes())
                .transactionDate(today)
                .build();
    }

    static GoalContribution contribution(ContributionCommand command, UUID transactionId, LocalDate today) {
        return GoalContribution.builder()
                .goalId(command.goalId())
                .userId(command.userId())
                .sourceAccountId(command.accountId())
                .transactionId(transactionId)
                .amount(command.amount())
                .contributionDate(today)
                .contributionType(command.contributionType())
                .notes(command.notes())
                .idempotencyKey(command.idempotencyKey())
                .build();
    }

    static RecordChange inserted(FinancialTransaction tx) {
        return new RecordChange(ChangeTable.TRANSACTIONS, ChangeType.INSERT, tx.getId(), columns(
                "goal_id", tx.getGoalId(),
                "user_id", tx.getUserId(),
                "account_id", tx.getAccountId()));
    }

    static RecordChange inserted(GoalContribution contribution) {
        return new RecordChange(ChangeTable.GOAL_CONTRIBUTIONS, ChangeType.INSERT, contribution.getId(), columns(
                "goal_id", contribution.getGoalId(),
                "user_id", contribution.getUserId()));
    }

    static RecordChange updated(Goal goal) {
        return new RecordChange(ChangeTable.GOALS, ChangeType.UPDATE, goal.getId(), columns(
                "user_id", goal.getUserId(),
                "family_id", goal.getFamilyId()));
    }

    // ignora valores nulos (ex. family_id de meta pessoal)
    private static Map<String, Object> columns(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                out.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return out;
    }
}
