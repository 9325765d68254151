package com.budgetme.goals.dto.contribution;

import com.budgetme.goals.services.contributions.ContributionError;
import com.budgetme.goals.services.contributions.ContributionStep;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Tudo o que a tela do fluxo de contribuição precisa para se desenhar.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContributionSessionDTO(
        String sessionId,
        ContributionStep step,
        boolean busy,
        String goalId,
        String accountId,
        String amount,
        String notes,
        List<GoalOptionDTO> eligibleGoals,
        List<AccountOptionDTO> accounts,
        ContributionPreviewDTO preview,
        ContributionError error,
        String contributionId
) {
}
