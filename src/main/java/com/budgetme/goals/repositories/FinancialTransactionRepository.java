package com.budgetme.goals.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.budgetme.goals.entities.FinancialTransaction;

public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID> {

    List<FinancialTransaction> findByGoalIdOrderByTransactionDateDesc(UUID goalId);
}
