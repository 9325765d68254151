package com.budgetme.goals.enums;

import java.math.BigDecimal;

public enum GoalStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean acceptsContributions() {
        return this == NOT_STARTED || this == IN_PROGRESS;
    }

    // status derivado depois de uma contribuição
    public static GoalStatus forProgress(BigDecimal currentAmount, BigDecimal targetAmount) {
        return currentAmount.compareTo(targetAmount) >= 0 ? COMPLETED : IN_PROGRESS;
    }
}
