package com.budgetme.goals.services.contributions;

import static com.budgetme.goals.services.contributions.GoalProgressUtils.formatCurrency;

import java.math.BigDecimal;
import java.util.List;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.services.contributions.commit.CommitResult;
import com.budgetme.goals.services.contributions.permission.PermissionDecision;

/**
 * Fábrica dos erros exibidos no fluxo de contribuição. Títulos distinguem
 * metas pessoais de familiares.
 */
public final class ContributionErrors {

    private ContributionErrors() {
    }

    private static String prefix(boolean familyGoal) {
        return familyGoal ? "Meta familiar" : "Meta pessoal";
    }

    public static ContributionError validation(boolean familyGoal, String message) {
        return ContributionError.builder()
                .type(ContributionErrorType.VALIDATION)
                .title(prefix(familyGoal) + " - Dados inválidos")
                .message(message)
                .suggestedActions(List.of(
                        "Preencha todos os campos obrigatórios",
                        "Informe um valor maior que zero",
                        "Selecione uma conta válida"))
                .retryable(true)
                .build();
    }

    public static ContributionError insufficientBalance(boolean familyGoal, Account account, BigDecimal shortfall) {
        return ContributionError.builder()
                .type(ContributionErrorType.BALANCE)
                .title(prefix(familyGoal) + " - Saldo insuficiente")
                .message("Saldo insuficiente em " + account.getAccountName())
                .details("Faltam " + formatCurrency(shortfall) + " para esta contribuição. Disponível: "
                        + formatCurrency(account.getBalance()))
                .suggestedActions(List.of(
                        "Escolha outra conta com saldo suficiente",
                        "Reduza o valor da contribuição",
                        familyGoal
                                ? "Peça a um administrador da família para adicionar saldo"
                                : "Transfira saldo para esta conta antes"))
                .retryable(true)
                .shortfall(shortfall)
                .build();
    }

    public static ContributionError goalLimit(boolean familyGoal, Goal goal, BigDecimal maxContribution) {
        return ContributionError.builder()
                .type(ContributionErrorType.GOAL_LIMIT)
                .title(prefix(familyGoal) + " - Limite da meta excedido")
                .message("O valor passa do que falta para concluir a meta. Contribuição máxima: "
                        + formatCurrency(maxContribution))
                .details("Alvo da meta: " + formatCurrency(goal.getTargetAmount()))
                .suggestedActions(List.of(
                        "Reduza o valor da contribuição",
                        "Confira quanto ainda falta para a meta"))
                .retryable(true)
                .maxContribution(maxContribution)
                .build();
    }

    public static ContributionError denied(boolean familyGoal, PermissionDecision decision) {
        ContributionErrorType type = decision.errorType() != null ? decision.errorType() : ContributionErrorType.PERMISSION;
        String title = switch (type) {
            case FAMILY_RESTRICTION -> "Meta familiar - Acesso restrito";
            case NETWORK -> prefix(familyGoal) + " - Erro de conexão";
            default -> prefix(familyGoal) + " - Permissão negada";
        };
        return ContributionError.builder()
                .type(type)
                .title(title)
                .message(decision.reason())
                .details(decision.role() != null ? "Seu papel na família: " + decision.role().name().toLowerCase(java.util.Locale.ROOT) : null)
                .suggestedActions(decision.suggestedActions())
                .retryable(type == ContributionErrorType.NETWORK)
                .build();
    }

    public static ContributionError network(boolean familyGoal, String details) {
        return ContributionError.builder()
                .type(ContributionErrorType.NETWORK)
                .title(prefix(familyGoal) + " - Erro de conexão")
                .message("Não foi possível concluir a contribuição. Nada foi debitado.")
                .details(details)
                .suggestedActions(List.of(
                        "Verifique sua conexão",
                        "Tente novamente em alguns instantes"))
                .retryable(true)
                .build();
    }

    public static ContributionError rejected(boolean familyGoal, CommitResult result) {
        ContributionErrorType type = result.rejectionType() != null ? result.rejectionType() : ContributionErrorType.VALIDATION;
        return ContributionError.builder()
                .type(type)
                .title(prefix(familyGoal) + " - Contribuição recusada")
                .message(result.reason())
                .suggestedActions(List.of(
                        "Confira o saldo atual da conta",
                        "Confira quanto ainda falta para a meta"))
                .retryable(type != ContributionErrorType.PERMISSION)
                .build();
    }

    public static ContributionError incompleteCommit(boolean familyGoal, CommitResult result) {
        return ContributionError.builder()
                .type(ContributionErrorType.INCOMPLETE_COMMIT)
                .title(prefix(familyGoal) + " - Ação pode não ter sido concluída")
                .message("A contribuição foi registrada, mas nem todos os saldos foram atualizados. "
                        + "Não tente novamente para evitar contribuição em dobro.")
                .details(result.reason())
                .suggestedActions(List.of(
                        "Atualize a página e confira o saldo da conta e o progresso da meta",
                        "Entre em contato com o suporte informando a contribuição " + result.contributionId()))
                .retryable(false)
                .completedSteps(result.completedSteps())
                .failedStep(result.failedStep())
                .build();
    }
}
