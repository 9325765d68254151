package com.budgetme.goals.dto.contribution;

import com.budgetme.goals.enums.ContributionType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record GoalContributionResponseDTO(
        String id,
        String goalId,
        String userId,
        String sourceAccountId,
        String transactionId,
        BigDecimal amount,
        LocalDate contributionDate,
        ContributionType contributionType,
        String notes,
        LocalDateTime createdAt
) {
}
