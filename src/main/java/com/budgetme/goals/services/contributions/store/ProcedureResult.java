package com.budgetme.goals.services.contributions.store;

import com.budgetme.goals.services.contributions.ContributionErrorType;

import java.util.UUID;

/**
 * Resultado do procedimento atômico. Falhas de infraestrutura não aparecem
 * aqui: saem como {@link com.budgetme.goals.exceptions.StoreException}.
 */
public record ProcedureResult(
        Status status,
        UUID contributionId,
        UUID transactionId,
        Rejection rejection,
        boolean replayed
) {

    public enum Status {
        OK,
        REJECTED,
        UNAVAILABLE
    }

    public enum Rejection {
        GOAL_NOT_FOUND(ContributionErrorType.VALIDATION, "Meta não encontrada"),
        GOAL_NOT_ACCEPTING(ContributionErrorType.VALIDATION, "A meta não aceita mais contribuições"),
        ACCOUNT_NOT_FOUND(ContributionErrorType.VALIDATION, "Conta não encontrada"),
        ACCOUNT_NOT_OWNED(ContributionErrorType.PERMISSION, "A conta não pertence ao usuário"),
        INSUFFICIENT_FUNDS(ContributionErrorType.BALANCE, "Saldo insuficiente"),
        GOAL_LIMIT_EXCEEDED(ContributionErrorType.GOAL_LIMIT, "Valor excede o restante da meta");

        private final ContributionErrorType errorType;
        private final String message;

        Rejection(ContributionErrorType errorType, String message) {
            this.errorType = errorType;
            this.message = message;
        }

        public ContributionErrorType errorType() {
            return errorType;
        }

        public String message() {
            return message;
        }
    }

    public static ProcedureResult ok(UUID contributionId, UUID transactionId) {
        return new ProcedureResult(Status.OK, contributionId, transactionId, null, false);
    }

    public static ProcedureResult replayed(UUID contributionId, UUID transactionId) {
        return new ProcedureResult(Status.OK, contributionId, transactionId, null, true);
    }

    public static ProcedureResult rejected(Rejection rejection) {
        return new ProcedureResult(Status.REJECTED, null, null, rejection, false);
    }

    public static ProcedureResult unavailable() {
        return new ProcedureResult(Status.UNAVAILABLE, null, null, null, false);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
