package com.budgetme.goals.services.contributions.commit;

import org.springframework.stereotype.Component;

import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.store.ProcedureResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Caminho preferido: um único procedimento transacional no servidor.
 * Qualquer falha aqui é NOT_COMMITTED, já que a transação é desfeita por inteiro.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AtomicProcedureCommitPipeline implements CommitPipeline {

    static final String UNAVAILABLE_REASON = "Procedimento atômico indisponível";

    private final ContributionStore store;

    @Override
    public CommitResult commit(ContributionCommand command) {
        ProcedureResult result;
        try {
            result = store.callAtomicContributeProcedure(command);
        } catch (RuntimeException e) {
            log.warn("[ContributionCommit] Procedimento atômico falhou para meta={} conta={}: {}",
                    command.goalId(), command.accountId(), e.getMessage());
            return CommitResult.notCommitted(CommitStrategy.ATOMIC_PROCEDURE, null, e.getMessage());
        }

        switch (result.status()) {
            case OK:
                if (result.replayed()) {
                    return CommitResult.replayed(
                            CommitStrategy.ATOMIC_PROCEDURE, result.contributionId(), result.transactionId());
                }
                return CommitResult.fullyCommitted(
                        CommitStrategy.ATOMIC_PROCEDURE, result.contributionId(), result.transactionId());
            case REJECTED:
                log.info("[ContributionCommit] Procedimento recusou contribuição para meta={}: {}",
                        command.goalId(), result.rejection());
                return CommitResult.rejected(
                        CommitStrategy.ATOMIC_PROCEDURE,
                        result.rejection().errorType(),
                        result.rejection().message());
            default:
                return CommitResult.notCommitted(CommitStrategy.ATOMIC_PROCEDURE, null, UNAVAILABLE_REASON);
        }
    }
}
