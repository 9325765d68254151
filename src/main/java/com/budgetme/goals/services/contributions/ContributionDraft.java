package com.budgetme.goals.services.contributions;

import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Entrada em andamento do usuário. Vive só em memória, dentro da sessão.
 * O valor fica como texto até a validação.
 */
@Getter
@Setter
public class ContributionDraft {

    private UUID goalId;
    private UUID accountId;
    private String amount;
    private String notes;
    private ContributionStep step = ContributionStep.SELECTION;

    // gerada na abertura e reaproveitada em novas tentativas do mesmo rascunho
    private final UUID idempotencyKey;

    public ContributionDraft(UUID idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public ContributionDraft copy() {
        ContributionDraft copy = new ContributionDraft(idempotencyKey);
        copy.setGoalId(goalId);
        copy.setAccountId(accountId);
        copy.setAmount(amount);
        copy.setNotes(notes);
        copy.setStep(step);
        return copy;
    }
}
