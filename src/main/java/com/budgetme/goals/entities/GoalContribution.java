package com.budgetme.goals.entities;

import com.budgetme.goals.enums.ContributionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Lançamento de registro de uma contribuição. Imutável depois de criado:
 * todas as colunas são {@code updatable = false}.
 */
@Entity
@Table(name = "goal_contributions",
        indexes = {
                @Index(name = "idx_goal_contributions_goal_id", columnList = "goal_id"),
                @Index(name = "idx_goal_contributions_user_id", columnList = "user_id"),
                @Index(name = "idx_goal_contributions_date", columnList = "contribution_date")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_goal_contributions_idempotency_key", columnNames = "idempotency_key")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GoalContribution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "goal_id", nullable = false, updatable = false)
    private UUID goalId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private UUID sourceAccountId;

    // referência ao lançamento genérico em financial_transactions
    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "contribution_date", nullable = false, updatable = false)
    private LocalDate contributionDate;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "contribution_type", nullable = false, updatable = false)
    private ContributionType contributionType = ContributionType.MANUAL;

    @Column(updatable = false, length = 500)
    private String notes;

    @Column(name = "idempotency_key", updatable = false)
    private UUID idempotencyKey;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
