package com.budgetme.goals.dto.contribution;

import com.budgetme.goals.enums.AccountType;

import java.math.BigDecimal;

public record AccountOptionDTO(
        String id,
        String accountName,
        AccountType accountType,
        BigDecimal balance
) {
}
