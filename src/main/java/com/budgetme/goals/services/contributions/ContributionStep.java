package com.budgetme.goals.services.contributions;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContributionStep {
    SELECTION,
    CONTRIBUTION,
    REVIEW,
    CLOSED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
