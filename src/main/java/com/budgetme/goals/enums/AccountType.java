package com.budgetme.goals.enums;

public enum AccountType {
    CHECKING,
    SAVINGS,
    CREDIT_CARD,
    CASH,
    INVESTMENT
}
