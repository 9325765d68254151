package com.budgetme.goals.repositories;

import com.budgetme.goals.entities.GoalContribution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GoalContributionRepository extends JpaRepository<GoalContribution, UUID> {

    List<GoalContribution> findByGoalIdOrderByCreatedAtDesc(UUID goalId);

    Optional<GoalContribution> findByIdempotencyKey(UUID idempotencyKey);

    boolean existsByIdempotencyKey(UUID idempotencyKey);

    long countByGoalId(UUID goalId);
}
