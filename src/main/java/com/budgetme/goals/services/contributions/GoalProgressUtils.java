package com.budgetme.goals.services.contributions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

import com.budgetme.goals.entities.Goal;

public final class GoalProgressUtils {

    public static final Locale LOCALE_PT_BR = new Locale("pt", "BR");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private GoalProgressUtils() {
    }

    public static BigDecimal safe(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Percentual de progresso com duas casas. Pode passar de 100 quando a meta
     * recebeu mais do que o alvo (overshoot concorrente).
     */
    public static BigDecimal percentage(BigDecimal current, BigDecimal target) {
        if (target == null || target.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return safe(current).multiply(HUNDRED).divide(target, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentage(Goal goal) {
        return percentage(goal.getCurrentAmount(), goal.getTargetAmount());
    }

    // null quando a meta não tem data alvo
    public static Long remainingDays(LocalDate targetDate, LocalDate today) {
        if (targetDate == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(today, targetDate);
    }

    public static BigDecimal dailyTarget(BigDecimal remaining, Long remainingDays) {
        if (remainingDays == null || remainingDays <= 0) {
            return null;
        }
        return safe(remaining).divide(BigDecimal.valueOf(remainingDays), 2, RoundingMode.HALF_UP);
    }

    public static String completionMessage(BigDecimal percentage) {
        if (percentage.compareTo(HUNDRED) >= 0) {
            return "Meta concluída! Parabéns!";
        }
        if (percentage.compareTo(BigDecimal.valueOf(75)) >= 0) {
            return "Quase lá! Falta pouco para concluir a meta.";
        }
        if (percentage.compareTo(BigDecimal.valueOf(50)) >= 0) {
            return "Metade do caminho percorrido!";
        }
        return "Continue assim, cada contribuição conta.";
    }

    public static String formatCurrency(BigDecimal amount) {
        NumberFormat nf = NumberFormat.getCurrencyInstance(LOCALE_PT_BR);
        return nf.format(safe(amount));
    }
}
