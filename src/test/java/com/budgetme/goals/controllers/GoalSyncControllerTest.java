package com.budgetme.goals.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.budgetme.goals.config.ContributionProperties;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.enums.GoalStatus;
import com.budgetme.goals.exceptions.StoreException;
import com.budgetme.goals.security.SecurityService;
import com.budgetme.goals.services.GoalContributionService;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.store.StoreSubscription;
import com.budgetme.goals.services.contributions.sync.GoalRealtimeSyncManager;

@ExtendWith(MockitoExtension.class)
class GoalSyncControllerTest {

    @Mock
    private ContributionStore store;

    @Mock
    private SecurityService securityService;

    private GoalRealtimeSyncManager syncManager;
    private GoalSyncController controller;

    private final UUID userId = UUID.randomUUID();
    private final UUID goalId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        syncManager = new GoalRealtimeSyncManager(store);
        controller = new GoalSyncController(syncManager, mock(GoalContributionService.class),
                securityService, ContributionProperties.defaults());

        when(securityService.getCurrentUserId()).thenReturn(userId);
        when(store.subscribeToChanges(any(), any(), any())).thenAnswer(inv ->
                new StoreSubscription(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
    }

    @Test
    void stream_initialReadFails_releasesChannelAndPropagates() {
        when(store.getGoal(goalId)).thenThrow(new StoreException("conexão recusada"));

        StoreException ex = assertThrows(StoreException.class, () -> controller.stream(goalId.toString()));

        assertEquals("conexão recusada", ex.getMessage());
        assertEquals(0, syncManager.activeChannels());
    }

    @Test
    void stream_initialReadSucceeds_keepsChannelOpen() {
        Goal goal = Goal.builder()
                .id(goalId)
                .userId(userId)
                .goalName("Reserva")
                .targetAmount(new BigDecimal("1000.00"))
                .currentAmount(new BigDecimal("100.00"))
                .status(GoalStatus.IN_PROGRESS)
                .build();
        when(store.getGoal(goalId)).thenReturn(Optional.of(goal));
        when(store.getContributionsForGoal(goalId)).thenReturn(List.of());

        SseEmitter emitter = controller.stream(goalId.toString());

        assertNotNull(emitter);
        assertEquals(1, syncManager.activeChannels());
    }
}
