package com.budgetme.goals.controllers;

import com.budgetme.goals.dto.ApiResponse;
import com.budgetme.goals.dto.contribution.AmountRequestDTO;
import com.budgetme.goals.dto.contribution.ContributionSessionDTO;
import com.budgetme.goals.dto.contribution.NotesRequestDTO;
import com.budgetme.goals.dto.contribution.SelectAccountRequestDTO;
import com.budgetme.goals.dto.contribution.SelectGoalRequestDTO;
import com.budgetme.goals.security.SecurityService;
import com.budgetme.goals.services.contributions.orchestrator.ContributionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Fluxo de contribuição em etapas. Erros de validação e permissão voltam
 * dentro da sessão ({@code data.error}) com status 200 e {@code success=false};
 * 409 indica operação fora de hora (etapa errada ou commit em andamento).
 */
@RestController
@RequestMapping("/api/contributions/sessions")
@RequiredArgsConstructor
public class ContributionController {

    private final ContributionOrchestrator orchestrator;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> open() {
        ContributionSessionDTO session = orchestrator.open(securityService.getCurrentUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(session, "Fluxo de contribuição iniciado"));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> view(@PathVariable UUID sessionId) {
        ContributionSessionDTO session = orchestrator.view(securityService.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(ApiResponse.success(session, "Sessão encontrada"));
    }

    @PutMapping("/{sessionId}/goal")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> selectGoal(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SelectGoalRequestDTO dto
    ) {
        ContributionSessionDTO session = orchestrator.selectGoal(securityService.getCurrentUserId(), sessionId, dto.getGoalId());
        return ResponseEntity.ok(outcome(session, "Meta selecionada"));
    }

    @PutMapping("/{sessionId}/amount")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> setAmount(
            @PathVariable UUID sessionId,
            @Valid @RequestBody AmountRequestDTO dto
    ) {
        ContributionSessionDTO session = orchestrator.setAmount(securityService.getCurrentUserId(), sessionId, dto.getAmount());
        return ResponseEntity.ok(ApiResponse.success(session, "Valor atualizado"));
    }

    @PutMapping("/{sessionId}/account")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> setAccount(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SelectAccountRequestDTO dto
    ) {
        ContributionSessionDTO session = orchestrator.setAccount(securityService.getCurrentUserId(), sessionId, dto.getAccountId());
        return ResponseEntity.ok(ApiResponse.success(session, "Conta selecionada"));
    }

    @PutMapping("/{sessionId}/notes")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> setNotes(
            @PathVariable UUID sessionId,
            @Valid @RequestBody NotesRequestDTO dto
    ) {
        ContributionSessionDTO session = orchestrator.setNotes(securityService.getCurrentUserId(), sessionId, dto.getNotes());
        return ResponseEntity.ok(ApiResponse.success(session, "Observação atualizada"));
    }

    @PostMapping("/{sessionId}/proceed")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> proceed(@PathVariable UUID sessionId) {
        ContributionSessionDTO session = orchestrator.proceed(securityService.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(outcome(session, "Etapa avançada"));
    }

    @PostMapping("/{sessionId}/back")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> back(@PathVariable UUID sessionId) {
        ContributionSessionDTO session = orchestrator.back(securityService.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(ApiResponse.success(session, "Etapa anterior"));
    }

    @PostMapping("/{sessionId}/confirm")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> confirm(@PathVariable UUID sessionId) {
        ContributionSessionDTO session = orchestrator.confirm(securityService.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(outcome(session, "Contribuição realizada com sucesso"));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<ContributionSessionDTO>> cancel(@PathVariable UUID sessionId) {
        ContributionSessionDTO session = orchestrator.cancel(securityService.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(ApiResponse.success(session, "Fluxo de contribuição cancelado"));
    }

    private ApiResponse<ContributionSessionDTO> outcome(ContributionSessionDTO session, String ok) {
        if (session.error() == null) {
            return ApiResponse.success(session, ok);
        }
        return ApiResponse.rejected(session, session.error().getTitle(), session.error().getMessage());
    }
}
