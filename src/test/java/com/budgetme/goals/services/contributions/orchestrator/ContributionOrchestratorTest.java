package com.budgetme.goals.services.contributions.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.budgetme.goals.dto.contribution.ContributionSessionDTO;
import com.budgetme.goals.entities.Account;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.FamilyRole;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.exceptions.ConflictException;
import com.budgetme.goals.exceptions.ResourceNotFoundException;
import com.budgetme.goals.services.contributions.ContributionCommand;
import com.budgetme.goals.services.contributions.ContributionErrorType;
import com.budgetme.goals.services.contributions.ContributionStep;
import com.budgetme.goals.services.contributions.commit.CommitPipeline;
import com.budgetme.goals.services.contributions.commit.CommitResult;
import com.budgetme.goals.services.contributions.commit.CommitStep;
import com.budgetme.goals.services.contributions.commit.CommitStrategy;
import com.budgetme.goals.services.contributions.permission.GoalPermissionGate;
import com.budgetme.goals.services.contributions.permission.PermissionDecision;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.sync.GoalRealtimeSyncManager;
import com.budgetme.goals.services.contributions.validation.ContributionValidator;

@ExtendWith(MockitoExtension.class)
class ContributionOrchestratorTest {

    @Mock
    private ContributionStore store;

    @Mock
    private GoalPermissionGate permissionGate;

    @Mock
    private CommitPipeline commitPipeline;

    @Mock
    private GoalRealtimeSyncManager syncManager;

    private ContributionSessionRegistry registry;
    private ContributionOrchestrator orchestrator;

    private final UUID userId = UUID.randomUUID();
    private Goal goal;
    private Account account;

    @BeforeEach
    void setUp() {
        registry = new ContributionSessionRegistry(Duration.ofMinutes(30), Clock.systemUTC());
        orchestrator = new ContributionOrchestrator(registry, store, permissionGate, new ContributionValidator(),
                commitPipeline, syncManager);

        goal = Goal.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .goalName("Casa própria")
                .targetAmount(new BigDecimal("10000.00"))
                .currentAmount(new BigDecimal("9500.00"))
                .status(GoalStatus.IN_PROGRESS)
                .build();
        account = Account.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .accountName("Itaú")
                .balance(new BigDecimal("1000.00"))
                .build();
    }

    private UUID open() {
        return UUID.fromString(orchestrator.open(userId).sessionId());
    }

    private UUID atContribution() {
        when(store.getGoal(goal.getId())).thenReturn(Optional.of(goal));
        when(permissionGate.canAccess(userId, goal)).thenReturn(PermissionDecision.allow(null));
        UUID sessionId = open();
        orchestrator.selectGoal(userId, sessionId, goal.getId());
        return sessionId;
    }

    private UUID atReview(String amount) {
        UUID sessionId = atContribution();
        when(store.getAccount(account.getId())).thenReturn(Optional.of(account));
        orchestrator.setAmount(userId, sessionId, amount);
        orchestrator.setAccount(userId, sessionId, account.getId());
        ContributionSessionDTO view = orchestrator.proceed(userId, sessionId);
        assertEquals(ContributionStep.REVIEW, view.step());
        return sessionId;
    }

    @Test
    void selectGoal_allowed_movesToContributionWithDefaultNote() {
        UUID sessionId = atContribution();

        ContributionSessionDTO view = orchestrator.view(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(goal.getId().toString(), view.goalId());
        assertEquals("Contribuição para Casa própria", view.notes());
        assertNull(view.error());
    }

    @Test
    void selectGoal_viewerOnFamilyGoal_staysAtSelection() {
        goal.setFamilyId(UUID.randomUUID());
        when(store.getGoal(goal.getId())).thenReturn(Optional.of(goal));
        when(permissionGate.canAccess(userId, goal)).thenReturn(PermissionDecision.deny(
                ContributionErrorType.FAMILY_RESTRICTION, "Visualizadores não contribuem",
                List.of("Peça acesso ao administrador"), FamilyRole.VIEWER));
        UUID sessionId = open();

        ContributionSessionDTO view = orchestrator.selectGoal(userId, sessionId, goal.getId());

        assertEquals(ContributionStep.SELECTION, view.step());
        assertNull(view.goalId());
        assertEquals(ContributionErrorType.FAMILY_RESTRICTION, view.error().getType());
        assertFalse(view.error().isRetryable());
        assertEquals(List.of("Peça acesso ao administrador"), view.error().getSuggestedActions());
    }

    @Test
    void selectGoal_completedGoal_staysAtSelection() {
        goal.setStatus(GoalStatus.COMPLETED);
        when(store.getGoal(goal.getId())).thenReturn(Optional.of(goal));
        when(permissionGate.canAccess(userId, goal)).thenReturn(PermissionDecision.allow(null));
        UUID sessionId = open();

        ContributionSessionDTO view = orchestrator.selectGoal(userId, sessionId, goal.getId());

        assertEquals(ContributionStep.SELECTION, view.step());
        assertEquals(ContributionErrorType.VALIDATION, view.error().getType());
    }

    @Test
    void proceed_amountAboveRemaining_staysWithGoalLimit() {
        UUID sessionId = atContribution();
        when(store.getAccount(account.getId())).thenReturn(Optional.of(account));
        orchestrator.setAmount(userId, sessionId, "600");
        orchestrator.setAccount(userId, sessionId, account.getId());

        ContributionSessionDTO view = orchestrator.proceed(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.GOAL_LIMIT, view.error().getType());
        assertEquals(0, new BigDecimal("500").compareTo(view.error().getMaxContribution()));
        verify(commitPipeline, never()).commit(any());
    }

    @Test
    void proceed_amountAboveBalance_staysWithShortfall() {
        account.setBalance(new BigDecimal("100.00"));
        UUID sessionId = atContribution();
        when(store.getAccount(account.getId())).thenReturn(Optional.of(account));
        orchestrator.setAmount(userId, sessionId, "500");
        orchestrator.setAccount(userId, sessionId, account.getId());

        ContributionSessionDTO view = orchestrator.proceed(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.BALANCE, view.error().getType());
        assertEquals(0, new BigDecimal("400").compareTo(view.error().getShortfall()));
    }

    @Test
    void proceed_accountOfAnotherUser_isNotResolved() {
        account.setUserId(UUID.randomUUID());
        UUID sessionId = atContribution();
        when(store.getAccount(account.getId())).thenReturn(Optional.of(account));
        orchestrator.setAmount(userId, sessionId, "100");
        orchestrator.setAccount(userId, sessionId, account.getId());

        ContributionSessionDTO view = orchestrator.proceed(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.VALIDATION, view.error().getType());
    }

    @Test
    void review_showsProspectiveGoalState() {
        UUID sessionId = atReview("500");

        ContributionSessionDTO view = orchestrator.view(userId, sessionId);

        assertNotNull(view.preview());
        assertEquals(0, new BigDecimal("10000").compareTo(view.preview().newAmount()));
        assertEquals(0, new BigDecimal("100").compareTo(view.preview().newPercentage()));
        assertTrue(view.preview().willComplete());
        assertEquals(0, new BigDecimal("500").compareTo(view.preview().accountBalanceAfter()));
    }

    @Test
    void confirm_fullyCommitted_closesAndSignalsSuccess() {
        UUID sessionId = atReview("500");
        UUID contributionId = UUID.randomUUID();
        when(commitPipeline.commit(any())).thenReturn(
                CommitResult.fullyCommitted(CommitStrategy.ATOMIC_PROCEDURE, contributionId, UUID.randomUUID()));
        List<ContributionSuccess> signals = new ArrayList<>();
        orchestrator.onContributionSuccess(userId, sessionId, signals::add);

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CLOSED, view.step());
        assertEquals(contributionId.toString(), view.contributionId());
        assertNull(view.error());
        assertEquals(1, signals.size());
        assertEquals(0, new BigDecimal("500").compareTo(signals.get(0).amount()));
        verify(syncManager).refresh(goal.getId());

        ArgumentCaptor<ContributionCommand> command = ArgumentCaptor.forClass(ContributionCommand.class);
        verify(commitPipeline).commit(command.capture());
        assertEquals(new BigDecimal("500.00"), command.getValue().amount());
        assertEquals(account.getId(), command.getValue().accountId());
        assertEquals(userId, command.getValue().userId());
    }

    @Test
    void confirm_notCommitted_returnsToContributionKeepingDraft() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenReturn(
                CommitResult.notCommitted(CommitStrategy.SEQUENTIAL_WRITES, CommitStep.LEDGER_ENTRY, "timeout"));

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.NETWORK, view.error().getType());
        assertTrue(view.error().isRetryable());
        assertEquals("500", view.amount());
        assertEquals(account.getId().toString(), view.accountId());
        verify(syncManager, never()).refresh(any());
    }

    @Test
    void confirm_retryAfterFailure_reusesIdempotencyKey() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenReturn(
                CommitResult.notCommitted(CommitStrategy.ATOMIC_PROCEDURE, null, "timeout"),
                CommitResult.fullyCommitted(CommitStrategy.ATOMIC_PROCEDURE, UUID.randomUUID(), UUID.randomUUID()));

        orchestrator.confirm(userId, sessionId);
        orchestrator.proceed(userId, sessionId);
        orchestrator.confirm(userId, sessionId);

        ArgumentCaptor<ContributionCommand> commands = ArgumentCaptor.forClass(ContributionCommand.class);
        verify(commitPipeline, times(2)).commit(commands.capture());
        assertEquals(commands.getAllValues().get(0).idempotencyKey(), commands.getAllValues().get(1).idempotencyKey());
    }

    @Test
    void confirm_partiallyCommitted_closesWithIncompleteCommit() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenReturn(CommitResult.partiallyCommitted(
                CommitStrategy.SEQUENTIAL_WRITES, UUID.randomUUID(), UUID.randomUUID(),
                List.of(CommitStep.LEDGER_ENTRY, CommitStep.ACCOUNT_BALANCE), CommitStep.GOAL_PROGRESS, "timeout"));
        List<ContributionSuccess> signals = new ArrayList<>();
        orchestrator.onContributionSuccess(userId, sessionId, signals::add);

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CLOSED, view.step());
        assertEquals(ContributionErrorType.INCOMPLETE_COMMIT, view.error().getType());
        assertFalse(view.error().isRetryable());
        assertEquals(CommitStep.GOAL_PROGRESS, view.error().getFailedStep());
        assertTrue(signals.isEmpty());
        verify(syncManager).refresh(goal.getId());
    }

    @Test
    void confirm_rejectedByStore_returnsToContribution() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenReturn(CommitResult.rejected(
                CommitStrategy.ATOMIC_PROCEDURE, ContributionErrorType.BALANCE, "Saldo insuficiente"));

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.BALANCE, view.error().getType());
    }

    @Test
    void confirm_permissionRevokedBeforeCommit_neverCommits() {
        UUID sessionId = atReview("500");
        when(permissionGate.canAccess(userId, goal)).thenReturn(PermissionDecision.deny(
                ContributionErrorType.PERMISSION, "Sem acesso", List.of(), null));

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.PERMISSION, view.error().getType());
        verify(commitPipeline, never()).commit(any());
    }

    @Test
    void confirm_balanceChangedSinceReview_revalidates() {
        UUID sessionId = atReview("500");
        account.setBalance(new BigDecimal("100.00"));

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.BALANCE, view.error().getType());
        verify(commitPipeline, never()).commit(any());
    }

    @Test
    void confirm_whileCommitInFlight_isRejected() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenAnswer(inv -> {
            assertThrows(ConflictException.class, () -> orchestrator.confirm(userId, sessionId));
            assertThrows(ConflictException.class, () -> orchestrator.back(userId, sessionId));
            assertThrows(ConflictException.class, () -> orchestrator.cancel(userId, sessionId));
            assertTrue(orchestrator.view(userId, sessionId).busy());
            return CommitResult.fullyCommitted(CommitStrategy.ATOMIC_PROCEDURE, UUID.randomUUID(), UUID.randomUUID());
        });

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CLOSED, view.step());
        assertFalse(view.busy());
        verify(commitPipeline, times(1)).commit(any());
    }

    @Test
    void confirm_pipelineThrows_isNetworkError() {
        UUID sessionId = atReview("500");
        when(commitPipeline.commit(any())).thenThrow(new IllegalStateException("pool esgotado"));

        ContributionSessionDTO view = orchestrator.confirm(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, view.step());
        assertEquals(ContributionErrorType.NETWORK, view.error().getType());
        assertFalse(view.busy());
    }

    @Test
    void confirm_outsideReview_isConflict() {
        UUID sessionId = atContribution();

        assertThrows(ConflictException.class, () -> orchestrator.confirm(userId, sessionId));
    }

    @Test
    void back_walksBackWithoutLosingInput() {
        UUID sessionId = atReview("500");

        ContributionSessionDTO contribution = orchestrator.back(userId, sessionId);
        ContributionSessionDTO selection = orchestrator.back(userId, sessionId);

        assertEquals(ContributionStep.CONTRIBUTION, contribution.step());
        assertEquals("500", contribution.amount());
        assertEquals(ContributionStep.SELECTION, selection.step());
        assertThrows(ConflictException.class, () -> orchestrator.back(userId, sessionId));
    }

    @Test
    void setAmount_atSelection_isConflict() {
        UUID sessionId = open();

        assertThrows(ConflictException.class, () -> orchestrator.setAmount(userId, sessionId, "10"));
    }

    @Test
    void cancel_closesAndForgetsSession() {
        UUID sessionId = atContribution();

        ContributionSessionDTO view = orchestrator.cancel(userId, sessionId);

        assertEquals(ContributionStep.CLOSED, view.step());
        assertThrows(ResourceNotFoundException.class, () -> orchestrator.view(userId, sessionId));
    }

    @Test
    void eligibleGoals_filtersClosedFullAndDeniedFamilyGoals() {
        Goal completed = Goal.builder().id(UUID.randomUUID()).userId(userId).goalName("A")
                .targetAmount(new BigDecimal("100")).currentAmount(new BigDecimal("100"))
                .status(GoalStatus.COMPLETED).build();
        Goal cancelled = Goal.builder().id(UUID.randomUUID()).userId(userId).goalName("B")
                .targetAmount(new BigDecimal("100")).status(GoalStatus.CANCELLED).build();
        Goal deniedFamily = Goal.builder().id(UUID.randomUUID()).userId(UUID.randomUUID())
                .familyId(UUID.randomUUID()).goalName("C").targetAmount(new BigDecimal("100"))
                .status(GoalStatus.IN_PROGRESS).build();
        Goal allowedFamily = Goal.builder().id(UUID.randomUUID()).userId(UUID.randomUUID())
                .familyId(UUID.randomUUID()).goalName("D").targetAmount(new BigDecimal("100"))
                .status(GoalStatus.NOT_STARTED).build();
        when(store.getGoalsVisibleTo(userId)).thenReturn(List.of(goal, completed, cancelled, deniedFamily, allowedFamily));
        when(permissionGate.canAccess(userId, deniedFamily)).thenReturn(PermissionDecision.deny(
                ContributionErrorType.FAMILY_RESTRICTION, "viewer", List.of(), FamilyRole.VIEWER));
        when(permissionGate.canAccess(userId, allowedFamily)).thenReturn(PermissionDecision.allow(FamilyRole.MEMBER));

        List<Goal> eligible = orchestrator.eligibleGoals(userId);

        assertEquals(List.of(goal, allowedFamily), eligible);
    }
}
