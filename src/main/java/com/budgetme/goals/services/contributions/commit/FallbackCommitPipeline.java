package com.budgetme.goals.services.contributions.commit;

import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import com.budgetme.goals.config.ContributionProperties;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.audit.ContributionAuditData;
import com.budgetme.goals.services.contributions.audit.ContributionAuditLogger;

import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline usado pelo orquestrador: tenta o procedimento atômico e, quando ele
 * não está disponível ou falha por infraestrutura, cai para as escritas avulsas.
 * Recusas de negócio do procedimento nunca disparam o fallback.
 */
@Slf4j
@Primary
@Component
public class FallbackCommitPipeline implements CommitPipeline {

    private final AtomicProcedureCommitPipeline atomic;
    private final SequentialWritesCommitPipeline sequential;
    private final ContributionAuditLogger auditLogger;
    private final ContributionProperties properties;

    public FallbackCommitPipeline(
            AtomicProcedureCommitPipeline atomic,
            SequentialWritesCommitPipeline sequential,
            ContributionAuditLogger auditLogger,
            ContributionProperties properties
    ) {
        this.atomic = atomic;
        this.sequential = sequential;
        this.auditLogger = auditLogger;
        this.properties = properties;
    }

    @Override
    public CommitResult commit(ContributionCommand command) {
        CommitResult result = atomic.commit(command);

        if (result.outcome() == CommitOutcome.NOT_COMMITTED && properties.fallbackEnabled()) {
            log.warn("[ContributionCommit] Usando escritas avulsas para meta={} (motivo: {})",
                    command.goalId(), result.reason());
            result = sequential.commit(command);
        }

        switch (result.outcome()) {
            case FULLY_COMMITTED -> {
                if (result.replayed()) {
                    log.info("[ContributionCommit] Chave {} já aplicada; contribuição {} reaproveitada sem nova auditoria",
                            command.idempotencyKey(), result.contributionId());
                } else {
                    auditLogger.logCreated(command.userId(), ContributionAuditData.of(command, result));
                }
            }
            case PARTIALLY_COMMITTED -> {
                log.error("[ContributionCommit] DIVERGÊNCIA: contribuição {} gravada parcialmente. "
                                + "meta={} conta={} usuario={} valor={} concluídos={} falhou={} motivo={}",
                        result.contributionId(), command.goalId(), command.accountId(), command.userId(),
                        command.amount(), result.completedSteps(), result.failedStep(), result.reason());
                auditLogger.logDivergence(command.userId(), command, result);
            }
            default -> log.debug("[ContributionCommit] Contribuição não gravada para meta={}: {} ({})",
                    command.goalId(), result.outcome(), result.reason());
        }
        return result;
    }
}
