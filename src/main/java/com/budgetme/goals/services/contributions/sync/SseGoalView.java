package com.budgetme.goals.services.contributions.sync;

import java.io.IOException;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.budgetme.goals.dto.sync.GoalSnapshotDTO;

import lombok.extern.slf4j.Slf4j;

/**
 * Adapta um {@link SseEmitter} para receber snapshots de meta.
 */
@Slf4j
public class SseGoalView implements GoalViewListener {

    static final String EVENT_NAME = "goal";

    private final SseEmitter emitter;

    public SseGoalView(SseEmitter emitter) {
        this.emitter = emitter;
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    @Override
    public void onGoalRefreshed(GoalSnapshotDTO snapshot) {
        try {
            emitter.send(SseEmitter.event()
                    .name(EVENT_NAME)
                    .id(snapshot.goalId() + ":" + snapshot.refreshedAt())
                    .data(snapshot));
        } catch (IOException | IllegalStateException e) {
            log.debug("[GoalSync] Stream SSE encerrado: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
