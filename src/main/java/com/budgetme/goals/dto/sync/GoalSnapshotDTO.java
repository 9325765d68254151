package com.budgetme.goals.dto.sync;

import com.budgetme.goals.dto.contribution.GoalContributionResponseDTO;
import com.budgetme.goals.enums.GoalStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Valor autoritativo de uma meta, relido depois de uma notificação de mudança.
 * {@code removed} indica que a meta não existe mais.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GoalSnapshotDTO(
        String goalId,
        String goalName,
        BigDecimal currentAmount,
        BigDecimal targetAmount,
        BigDecimal progressPercentage,
        GoalStatus status,
        boolean overshoot,
        boolean removed,
        List<GoalContributionResponseDTO> contributions,
        LocalDateTime refreshedAt
) {

    public static GoalSnapshotDTO removed(String goalId) {
        return new GoalSnapshotDTO(goalId, null, null, null, null, null, false, true, List.of(), LocalDateTime.now());
    }
}
