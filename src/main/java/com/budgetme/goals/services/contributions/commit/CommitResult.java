package com.budgetme.goals.services.contributions.commit;

import com.budgetme.goals.services.contributions.ContributionErrorType;

import java.util.List;
import java.util.UUID;

public record CommitResult(
        CommitStrategy strategy,
        CommitOutcome outcome,
        UUID contributionId,
        UUID transactionId,
        List<CommitStep> completedSteps,
        CommitStep failedStep,
        String reason,
        ContributionErrorType rejectionType,
        boolean replayed
) {
    private static final List<CommitStep> ALL_STEPS =
            List.of(CommitStep.LEDGER_ENTRY, CommitStep.ACCOUNT_BALANCE, CommitStep.GOAL_PROGRESS);

    public CommitResult {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
    }

    public static CommitResult fullyCommitted(CommitStrategy strategy, UUID contributionId, UUID transactionId) {
        return new CommitResult(strategy, CommitOutcome.FULLY_COMMITTED, contributionId, transactionId,
                ALL_STEPS, null, null, null, false);
    }

    // chave de idempotência já aplicada por uma tentativa anterior; nada foi gravado agora
    public static CommitResult replayed(CommitStrategy strategy, UUID contributionId, UUID transactionId) {
        return new CommitResult(strategy, CommitOutcome.FULLY_COMMITTED, contributionId, transactionId,
                ALL_STEPS, null, null, null, true);
    }

    public static CommitResult partiallyCommitted(
            CommitStrategy strategy,
            UUID contributionId,
            UUID transactionId,
            List<CommitStep> completedSteps,
            CommitStep failedStep,
            String reason
    ) {
        return new CommitResult(strategy, CommitOutcome.PARTIALLY_COMMITTED, contributionId, transactionId,
                completedSteps, failedStep, reason, null, false);
    }

    public static CommitResult notCommitted(CommitStrategy strategy, CommitStep failedStep, String reason) {
        return new CommitResult(strategy, CommitOutcome.NOT_COMMITTED, null, null,
                List.of(), failedStep, reason, null, false);
    }

    public static CommitResult rejected(CommitStrategy strategy, ContributionErrorType type, String reason) {
        return new CommitResult(strategy, CommitOutcome.REJECTED, null, null,
                List.of(), null, reason, type, false);
    }

    public boolean isSuccess() {
        return outcome == CommitOutcome.FULLY_COMMITTED;
    }
}
