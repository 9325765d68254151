package com.budgetme.goals.services.contributions.audit;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

import com.budgetme.goals.enums.ContributionType;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.commit.CommitResult;

public record ContributionAuditData(
        UUID contributionId,
        UUID goalId,
        String goalName,
        UUID accountId,
        String accountName,
        UUID transactionId,
        BigDecimal amount,
        ContributionType contributionType,
        String notes,
        LocalDate contributionDate,
        String createdVia
) {

    public static ContributionAuditData of(ContributionCommand command, CommitResult result) {
        return new ContributionAuditData(
                result.contributionId(),
                command.goalId(),
                command.goalName(),
                command.accountId(),
                command.accountName(),
                result.transactionId(),
                command.amount(),
                command.contributionType(),
                command.notes(),
                LocalDate.now(),
                result.strategy().name().toLowerCase(Locale.ROOT)
        );
    }
}
