package com.budgetme.goals.services.contributions;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.ContributionType;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.repositories.AccountRepository;
import com.budgetme.goals.repositories.FinancialTransactionRepository;
import com.budgetme.goals.repositories.GoalContributionRepository;
import com.budgetme.goals.repositories.GoalRepository;
import com.budgetme.goals.services.contributions.commit.CommitOutcome;
import com.budgetme.goals.services.contributions.commit.CommitPipeline;
import com.budgetme.goals.services.contributions.commit.CommitResult;
import com.budgetme.goals.services.contributions.commit.CommitStep;
import com.budgetme.goals.services.contributions.commit.CommitStrategy;

@SpringBootTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.datasource.url=jdbc:h2:mem:budgetme_fallback;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driverClassName=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect",
        "jwt.secret=01234567890123456789012345678901",
        "budgetme.contributions.atomic-procedure-enabled=false"
})
class SequentialFallbackIntegrationTest {

    @Autowired
    private CommitPipeline commitPipeline;

    @Autowired
    private GoalRepository goalRepository;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private GoalContributionRepository contributionRepository;

    @Autowired
    private FinancialTransactionRepository transactionRepository;

    private final UUID userId = UUID.randomUUID();

    @AfterEach
    void cleanUp() {
        contributionRepository.deleteAll();
        transactionRepository.deleteAll();
        goalRepository.deleteAll();
        accountRepository.deleteAll();
    }

    @Test
    void atomicDisabled_sequentialWritesApplyAllEffects() {
        Goal goal = goalRepository.save(Goal.builder()
                .userId(userId)
                .goalName("Bicicleta")
                .targetAmount(new BigDecimal("2000.00"))
                .currentAmount(new BigDecimal("0.00"))
                .build());
        Account account = accountRepository.save(Account.builder()
                .userId(userId)
                .accountName("Carteira")
                .balance(new BigDecimal("750.00"))
                .build());
        ContributionCommand command = new ContributionCommand(goal.getId(), account.getId(), userId,
                new BigDecimal("250.00"), null, ContributionType.MANUAL, UUID.randomUUID(), "Bicicleta", "Carteira");

        CommitResult result = commitPipeline.commit(command);

        assertEquals(CommitOutcome.FULLY_COMMITTED, result.outcome());
        assertEquals(CommitStrategy.SEQUENTIAL_WRITES, result.strategy());

        Goal savedGoal = goalRepository.findById(goal.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("250").compareTo(savedGoal.getCurrentAmount()));
        assertEquals(GoalStatus.IN_PROGRESS, savedGoal.getStatus());
        assertEquals(0, new BigDecimal("500").compareTo(
                accountRepository.findById(account.getId()).orElseThrow().getBalance()));
        assertEquals(1, contributionRepository.countByGoalId(goal.getId()));
    }

    @Test
    void atomicDisabled_sameKeyTwice_secondReportsExistingEntryWithoutReapplying() {
        Goal goal = goalRepository.save(Goal.builder()
                .userId(userId)
                .goalName("Curso")
                .targetAmount(new BigDecimal("900.00"))
                .build());
        Account account = accountRepository.save(Account.builder()
                .userId(userId)
                .accountName("Carteira")
                .balance(new BigDecimal("500.00"))
                .build());
        ContributionCommand command = new ContributionCommand(goal.getId(), account.getId(), userId,
                new BigDecimal("100.00"), null, null, UUID.randomUUID(), "Curso", "Carteira");

        CommitResult first = commitPipeline.commit(command);
        CommitResult second = commitPipeline.commit(command);

        assertEquals(CommitOutcome.PARTIALLY_COMMITTED, second.outcome());
        assertEquals(first.contributionId(), second.contributionId());
        assertEquals(List.of(CommitStep.LEDGER_ENTRY), second.completedSteps());
        assertEquals(1, contributionRepository.countByGoalId(goal.getId()));
        assertEquals(0, new BigDecimal("400").compareTo(
                accountRepository.findById(account.getId()).orElseThrow().getBalance()));
    }
}
