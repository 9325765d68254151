package com.budgetme.goals.enums;

public enum TransactionType {
    INCOME,
    EXPENSE,
    CONTRIBUTION
}
