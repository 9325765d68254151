package com.budgetme.goals.repositories;

import com.budgetme.goals.entities.Goal;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GoalRepository extends JpaRepository<Goal, UUID> {

    List<Goal> findByUserIdAndFamilyIdIsNull(UUID userId);

    List<Goal> findByFamilyIdIn(Collection<UUID> familyIds);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Goal g WHERE g.id = :id")
    Optional<Goal> findByIdForUpdate(@Param("id") UUID id);
}
