package com.budgetme.goals.services;

import com.budgetme.goals.entities.AuditEvent;
import com.budgetme.goals.enums.AuditEventStatus;
import com.budgetme.goals.repositories.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditEventRepository auditEventRepository;

    // transação própria: falha aqui nunca desfaz a operação auditada
    @Async("auditTaskExecutor")
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(AuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.error("[Audit] Falha ao salvar evento de auditoria {} ({})", event.getAction(), event.getEntityId(), e);
        }
    }

    /**
     * Monta o evento sem persistir. {@code errorMessage} só é preenchido em
     * eventos FAILURE (ex.: divergência de commit parcial).
     */
    public AuditEvent createEvent(
            String userId,
            String action,
            String entityId,
            String entityType,
            Map<String, Object> details,
            AuditEventStatus status,
            String errorMessage
    ) {
        return AuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .userId(userId)
                .action(action)
                .entityId(entityId)
                .entityType(entityType)
                .details(details)
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }
}
