package com.budgetme.goals.mappers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import com.budgetme.goals.dto.contribution.AccountOptionDTO;
import com.budgetme.goals.dto.contribution.GoalContributionResponseDTO;
import com.budgetme.goals.dto.contribution.GoalOptionDTO;
import com.budgetme.goals.dto.sync.GoalSnapshotDTO;
import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.services.contributions.GoalProgressUtils;

public class GoalContributionMapper {

    static final long URGENT_DAYS = 30;
    static final BigDecimal NEAR_COMPLETION_PERCENT = BigDecimal.valueOf(80);

    private GoalContributionMapper() {}

    public static GoalContributionResponseDTO toResponseDTO(GoalContribution entity) {
        return new GoalContributionResponseDTO(
                entity.getId().toString(),
                entity.getGoalId().toString(),
                entity.getUserId().toString(),
                entity.getSourceAccountId().toString(),
                entity.getTransactionId() != null ? entity.getTransactionId().toString() : null,
                entity.getAmount(),
                entity.getContributionDate(),
                entity.getContributionType(),
                entity.getNotes(),
                entity.getCreatedAt()
        );
    }

    public static AccountOptionDTO toAccountOption(Account account) {
        return new AccountOptionDTO(
                account.getId().toString(),
                account.getAccountName(),
                account.getAccountType(),
                account.getBalance()
        );
    }

    // indicadores do card: urgente até 30 dias, quase concluída a partir de 80%
    public static GoalOptionDTO toGoalOption(Goal goal, LocalDate today) {
        BigDecimal percentage = GoalProgressUtils.percentage(goal);
        BigDecimal remaining = goal.remainingAmount();
        Long remainingDays = GoalProgressUtils.remainingDays(goal.getTargetDate(), today);

        return new GoalOptionDTO(
                goal.getId().toString(),
                goal.getGoalName(),
                goal.isFamilyGoal(),
                goal.getTargetAmount(),
                goal.getCurrentAmount(),
                remaining,
                percentage,
                goal.getTargetDate(),
                remainingDays,
                remainingDays != null && remainingDays >= 0 && remainingDays <= URGENT_DAYS,
                percentage.compareTo(NEAR_COMPLETION_PERCENT) >= 0,
                GoalProgressUtils.dailyTarget(remaining, remainingDays),
                goal.getPriority(),
                goal.getStatus()
        );
    }

    public static GoalSnapshotDTO toSnapshot(Goal goal, List<GoalContribution> contributions) {
        boolean overshoot = goal.getCurrentAmount().compareTo(goal.getTargetAmount()) > 0;
        return new GoalSnapshotDTO(
                goal.getId().toString(),
                goal.getGoalName(),
                goal.getCurrentAmount(),
                goal.getTargetAmount(),
                GoalProgressUtils.percentage(goal),
                goal.getStatus(),
                overshoot,
                false,
                contributions.stream().map(GoalContributionMapper::toResponseDTO).toList(),
                LocalDateTime.now()
        );
    }
}
