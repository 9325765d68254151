package com.budgetme.goals.services.contributions.audit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.budgetme.goals.entities.AuditEvent;
import com.budgetme.goals.enums.AuditEventStatus;
import com.budgetme.goals.services.AuditService;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.commit.CommitResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registro de auditoria das contribuições. Melhor esforço: qualquer erro é
 * logado e descartado, nunca chega ao chamador.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContributionAuditLogger {

    public static final String ACTION_CREATED = "GOAL_CONTRIBUTION_CREATED";
    public static final String ACTION_DIVERGENCE = "GOAL_CONTRIBUTION_DIVERGENCE";
    static final String ENTITY_TYPE = "GoalContribution";

    private final AuditService auditService;

    public void logCreated(UUID userId, ContributionAuditData data) {
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("contribution_id", str(data.contributionId()));
            details.put("goal_id", str(data.goalId()));
            details.put("goal_name", data.goalName());
            details.put("account_id", str(data.accountId()));
            details.put("account_name", data.accountName());
            details.put("transaction_id", str(data.transactionId()));
            details.put("amount", data.amount() != null ? data.amount().toPlainString() : null);
            details.put("contribution_type", data.contributionType() != null ? data.contributionType().name() : null);
            details.put("notes", data.notes());
            details.put("contribution_date", data.contributionDate() != null ? data.contributionDate().toString() : null);
            details.put("created_via", data.createdVia());

            AuditEvent event = auditService.createEvent(
                    userId.toString(),
                    ACTION_CREATED,
                    str(data.contributionId()),
                    ENTITY_TYPE,
                    details,
                    AuditEventStatus.SUCCESS,
                    null
            );
            auditService.logEvent(event);
        } catch (Exception e) {
            log.error("[ContributionAudit] Falha ao auditar contribuição {}", data.contributionId(), e);
        }
    }

    public void logDivergence(UUID userId, ContributionCommand command, CommitResult result) {
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("goal_id", str(command.goalId()));
            details.put("account_id", str(command.accountId()));
            details.put("transaction_id", str(result.transactionId()));
            details.put("amount", command.amount().toPlainString());
            details.put("completed_steps", result.completedSteps().stream().map(Enum::name).toList());
            details.put("failed_step", result.failedStep() != null ? result.failedStep().name() : null);
            details.put("strategy", result.strategy().name());

            AuditEvent event = auditService.createEvent(
                    userId.toString(),
                    ACTION_DIVERGENCE,
                    str(result.contributionId()),
                    ENTITY_TYPE,
                    details,
                    AuditEventStatus.FAILURE,
                    result.reason()
            );
            auditService.logEvent(event);
        } catch (Exception e) {
            log.error("[ContributionAudit] Falha ao auditar divergência da contribuição {}", result.contributionId(), e);
        }
    }

    private static String str(Object value) {
        return value != null ? value.toString() : null;
    }
}
