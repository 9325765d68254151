package com.budgetme.goals.enums;

public enum GoalPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
