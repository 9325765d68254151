package com.budgetme.goals.services.contributions.orchestrator;

import java.math.BigDecimal;
import java.util.UUID;

public record ContributionSuccess(
        UUID sessionId,
        UUID userId,
        UUID goalId,
        UUID accountId,
        UUID contributionId,
        BigDecimal amount
) {
}
