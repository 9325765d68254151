package com.budgetme.goals.services.contributions;

import com.budgetme.goals.enums.ContributionType;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Contribuição já validada, pronta para o pipeline de commit.
 * {@code goalName} e {@code accountName} servem só para auditoria.
 */
public record ContributionCommand(
        UUID goalId,
        UUID accountId,
        UUID userId,
        BigDecimal amount,
        String notes,
        ContributionType contributionType,
        UUID idempotencyKey,
        String goalName,
        String accountName
) {
    public ContributionCommand {
        if (contributionType == null) {
            contributionType = ContributionType.MANUAL;
        }
    }
}
