package com.budgetme.goals.controllers;

import com.budgetme.goals.config.ContributionProperties;
import com.budgetme.goals.dto.ApiResponse;
import com.budgetme.goals.dto.contribution.GoalContributionResponseDTO;
import com.budgetme.goals.security.SecurityService;
import com.budgetme.goals.services.GoalContributionService;
import com.budgetme.goals.services.contributions.sync.GoalRealtimeSyncManager;
import com.budgetme.goals.services.contributions.sync.SseGoalView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/goals")
@RequiredArgsConstructor
public class GoalSyncController {

    private final GoalRealtimeSyncManager syncManager;
    private final GoalContributionService contributionService;
    private final SecurityService securityService;
    private final ContributionProperties properties;

    @GetMapping(value = "/{goalId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @PreAuthorize("@securityService.canViewGoal(#goalId)")
    public SseEmitter stream(@PathVariable String goalId) {
        UUID id = UUID.fromString(goalId);
        UUID userId = securityService.getCurrentUserId();

        SseEmitter emitter = new SseEmitter(properties.streamTimeout().toMillis());
        SseGoalView view = new SseGoalView(emitter);

        emitter.onCompletion(() -> syncManager.teardown(view));
        emitter.onTimeout(() -> syncManager.teardown(view));
        emitter.onError(e -> syncManager.teardown(view));

        // assina antes da leitura inicial para não perder mudanças entre as duas
        syncManager.subscribe(id, userId, view);
        try {
            view.onGoalRefreshed(syncManager.fetchSnapshot(id));
        } catch (RuntimeException e) {
            // o emitter nunca chega ao cliente, então os callbacks acima não disparam
            syncManager.teardown(view);
            log.warn("[GoalSync] Leitura inicial da meta {} falhou; stream descartado: {}", id, e.getMessage());
            throw e;
        }
        log.debug("[GoalSync] Stream aberto para meta {} usuário {}", id, userId);
        return emitter;
    }

    @PostMapping("/sync/refocus")
    public ResponseEntity<ApiResponse<Void>> refocus() {
        syncManager.onWindowRefocused(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(null, "Metas sincronizadas"));
    }

    @GetMapping("/{goalId}/contributions")
    @PreAuthorize("@securityService.canViewGoal(#goalId)")
    public ResponseEntity<ApiResponse<List<GoalContributionResponseDTO>>> contributions(@PathVariable String goalId) {
        List<GoalContributionResponseDTO> list = contributionService.findByGoal(UUID.fromString(goalId));
        return ResponseEntity.ok(ApiResponse.success(list, "Contribuições encontradas"));
    }
}
