package com.budgetme.goals.services.contributions.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.services.contributions.ContributionDraft;
import com.budgetme.goals.services.contributions.ContributionErrors;

/**
 * Checagens puras sobre uma contribuição proposta, na ordem:
 * 1. valor presente e maior que zero (no máximo 2 casas)
 * 2. conta selecionada
 * 3. meta selecionada
 * 4. conta resolvida
 * 5. saldo suficiente
 * 6. valor não passa do restante da meta
 * Para na primeira falha.
 */
@Component
public class ContributionValidator {

    // NUMERIC(15,2): até 13 dígitos inteiros
    static final int MAX_INTEGER_DIGITS = 13;

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    public ValidationOutcome validate(ContributionDraft draft, Goal goal, Account account) {
        boolean family = goal != null && goal.isFamilyGoal();

        BigDecimal amount = parseAmount(draft.getAmount());
        if (amount == null || amount.signum() <= 0) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "Informe um valor válido maior que zero"));
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "O valor deve ter no máximo duas casas decimais"));
        }
        if (amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "O valor informado excede o máximo permitido"));
        }

        if (draft.getAccountId() == null) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "Selecione a conta de origem da contribuição"));
        }

        if (goal == null) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "Nenhuma meta selecionada para a contribuição"));
        }

        if (account == null || !draft.getAccountId().equals(account.getId()) || account.getBalance() == null) {
            return ValidationOutcome.failed(ContributionErrors.validation(family,
                    "A conta selecionada não foi encontrada ou não está mais disponível"));
        }

        if (account.getBalance().compareTo(amount) < 0) {
            BigDecimal shortfall = amount.subtract(account.getBalance());
            return ValidationOutcome.failed(ContributionErrors.insufficientBalance(family, account, shortfall));
        }

        // regra de produto: uma contribuição não pode ultrapassar o alvo
        BigDecimal remaining = goal.remainingAmount();
        if (amount.compareTo(remaining) > 0) {
            return ValidationOutcome.failed(ContributionErrors.goalLimit(family, goal, remaining));
        }

        return ValidationOutcome.ok(amount.setScale(2, RoundingMode.UNNECESSARY));
    }

    /**
     * Aceita "500", "500.5" e "500,50". Devolve null para texto vazio ou inválido,
     * incluindo notação exponencial ("1e9").
     */
    public static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim();
        if (normalized.indexOf(',') >= 0 && normalized.indexOf('.') < 0) {
            normalized = normalized.replace(',', '.');
        }
        if (!PLAIN_DECIMAL.matcher(normalized).matches()) {
            return null;
        }
        return new BigDecimal(normalized);
    }
}
