package com.budgetme.goals.dto.contribution;

import com.budgetme.goals.enums.GoalPriority;
import com.budgetme.goals.enums.GoalStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Meta elegível exibida na etapa de seleção, com os indicadores do card.
 */
public record GoalOptionDTO(
        String id,
        String goalName,
        boolean familyGoal,
        BigDecimal targetAmount,
        BigDecimal currentAmount,
        BigDecimal remainingAmount,
        BigDecimal progressPercentage,
        LocalDate targetDate,
        Long remainingDays,
        boolean urgent,
        boolean nearCompletion,
        BigDecimal dailyTarget,
        GoalPriority priority,
        GoalStatus status
) {
}
