package com.budgetme.goals.services.contributions;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContributionErrorType {
    VALIDATION,
    BALANCE,
    GOAL_LIMIT,
    FAMILY_RESTRICTION,
    PERMISSION,
    NETWORK,
    // commit parcial: o usuário não deve simplesmente tentar de novo
    INCOMPLETE_COMMIT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
