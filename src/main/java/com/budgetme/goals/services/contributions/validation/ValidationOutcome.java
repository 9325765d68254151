package com.budgetme.goals.services.contributions.validation;

import com.budgetme.goals.services.contributions.ContributionError;

import java.math.BigDecimal;

public record ValidationOutcome(boolean valid, BigDecimal amount, ContributionError error) {

    public static ValidationOutcome ok(BigDecimal amount) {
        return new ValidationOutcome(true, amount, null);
    }

    public static ValidationOutcome failed(ContributionError error) {
        return new ValidationOutcome(false, null, error);
    }
}
