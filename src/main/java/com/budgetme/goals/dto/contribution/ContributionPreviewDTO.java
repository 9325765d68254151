package com.budgetme.goals.dto.contribution;

import java.math.BigDecimal;

/**
 * Estado previsto da meta caso a contribuição seja confirmada.
 */
public record ContributionPreviewDTO(
        BigDecimal amount,
        BigDecimal currentAmount,
        BigDecimal newAmount,
        BigDecimal targetAmount,
        BigDecimal newPercentage,
        BigDecimal remainingAfter,
        boolean willComplete,
        String completionMessage,
        BigDecimal accountBalanceAfter
) {
}
