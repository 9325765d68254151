package com.budgetme.goals.mappers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.budgetme.goals.dto.contribution.GoalOptionDTO;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.GoalStatus;

class GoalContributionMapperTest {

    private final LocalDate today = LocalDate.of(2026, 5, 1);

    private Goal goal(String current, LocalDate targetDate) {
        return Goal.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .goalName("Carro")
                .targetAmount(new BigDecimal("1000.00"))
                .currentAmount(new BigDecimal(current))
                .targetDate(targetDate)
                .status(GoalStatus.IN_PROGRESS)
                .build();
    }

    @Test
    void toGoalOption_dueSoonAndNearlyDone_isFlagged() {
        GoalOptionDTO option = GoalContributionMapper.toGoalOption(goal("850.00", today.plusDays(10)), today);

        assertTrue(option.urgent());
        assertTrue(option.nearCompletion());
        assertEquals(10L, option.remainingDays());
        assertEquals(0, new BigDecimal("15.00").compareTo(option.dailyTarget()));
        assertEquals(0, new BigDecimal("150").compareTo(option.remainingAmount()));
    }

    @Test
    void toGoalOption_farAwayAndEarly_isNotFlagged() {
        GoalOptionDTO option = GoalContributionMapper.toGoalOption(goal("100.00", today.plusDays(200)), today);

        assertFalse(option.urgent());
        assertFalse(option.nearCompletion());
    }

    @Test
    void toGoalOption_withoutDate_hasNoDailyTarget() {
        GoalOptionDTO option = GoalContributionMapper.toGoalOption(goal("100.00", null), today);

        assertNull(option.remainingDays());
        assertNull(option.dailyTarget());
        assertFalse(option.urgent());
    }

    @Test
    void toGoalOption_pastDue_isNotUrgent() {
        GoalOptionDTO option = GoalContributionMapper.toGoalOption(goal("100.00", today.minusDays(3)), today);

        assertFalse(option.urgent());
        assertNull(option.dailyTarget());
    }
}
