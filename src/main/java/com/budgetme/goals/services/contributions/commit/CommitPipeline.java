package com.budgetme.goals.services.contributions.commit;

import com.budgetme.goals.services.contributions.ContributionCommand;

/**
 * Executa a mudança de estado de uma contribuição. Nunca lança exceção para
 * falhas de armazenamento: o resultado diz o que foi e o que não foi gravado.
 */
public interface CommitPipeline {

    CommitResult commit(ContributionCommand command);
}
