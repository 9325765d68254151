package com.budgetme.goals.enums;

public enum MembershipStatus {
    ACTIVE,
    PENDING,
    INACTIVE,
    REMOVED
}
