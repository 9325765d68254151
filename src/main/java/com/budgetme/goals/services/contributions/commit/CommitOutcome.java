package com.budgetme.goals.services.contributions.commit;

public enum CommitOutcome {
    FULLY_COMMITTED,
    /** Parte dos efeitos foi gravada. Dados divergentes, precisa de reconciliação. */
    PARTIALLY_COMMITTED,
    /** Nada foi gravado; pode ser tentado de novo. */
    NOT_COMMITTED,
    /** O armazenamento recusou por regra de negócio (saldo, limite da meta...). */
    REJECTED
}
