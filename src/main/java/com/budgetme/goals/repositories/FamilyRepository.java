package com.budgetme.goals.repositories;

import com.budgetme.goals.entities.Family;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface FamilyRepository extends JpaRepository<Family, UUID> {
}
