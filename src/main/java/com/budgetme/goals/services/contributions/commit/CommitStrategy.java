package com.budgetme.goals.services.contributions.commit;

public enum CommitStrategy {
    ATOMIC_PROCEDURE,
    SEQUENTIAL_WRITES
}
