package com.budgetme.goals.services.contributions.commit;

/**
 * Efeitos de uma contribuição, na ordem fixa em que as escritas avulsas os aplicam.
 */
public enum CommitStep {
    LEDGER_ENTRY,
    ACCOUNT_BALANCE,
    GOAL_PROGRESS
}
