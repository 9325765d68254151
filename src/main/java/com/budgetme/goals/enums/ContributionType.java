package com.budgetme.goals.enums;

public enum ContributionType {
    MANUAL,
    AUTOMATIC,
    TRANSFER
}
