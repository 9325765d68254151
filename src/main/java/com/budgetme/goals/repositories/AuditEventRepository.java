package com.budgetme.goals.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.budgetme.goals.entities.AuditEvent;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    // trilha de um registro (ex.: GoalContribution) para conciliação
    List<AuditEvent> findByEntityTypeAndEntityId(String entityType, String entityId);
}
