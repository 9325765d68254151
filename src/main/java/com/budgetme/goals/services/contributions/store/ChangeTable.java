package com.budgetme.goals.services.contributions.store;

public enum ChangeTable {
    GOALS,
    GOAL_CONTRIBUTIONS,
    TRANSACTIONS
}
