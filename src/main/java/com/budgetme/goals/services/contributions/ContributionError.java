package com.budgetme.goals.services.contributions;

import com.budgetme.goals.services.contributions.commit.CommitStep;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Erro tipado exibido ao usuário durante o fluxo de contribuição.
 * É dado, não exceção: fica na sessão até a próxima ação.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContributionError {

    ContributionErrorType type;
    String title;
    String message;
    String details;
    List<String> suggestedActions;
    boolean retryable;

    // goal_limit
    BigDecimal maxContribution;

    // balance
    BigDecimal shortfall;

    // incomplete_commit
    List<CommitStep> completedSteps;
    CommitStep failedStep;
}
