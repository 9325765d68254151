package com.budgetme.goals.services.contributions.orchestrator;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import com.budgetme.goals.exceptions.ConflictException;
import com.budgetme.goals.services.contributions.ContributionDraft;
import com.budgetme.goals.services.contributions.ContributionError;
import com.budgetme.goals.services.contributions.ContributionStep;

import lombok.Getter;
import lombok.Setter;

/**
 * Máquina de estados de um fluxo de contribuição:
 * seleção → contribuição → revisão → (commit) → fechado.
 * <p>
 * Guarda o rascunho e o erro atual. Só um commit pode estar em andamento por
 * sessão; enquanto ele roda, qualquer outra operação é recusada.
 */
public class ContributionSession {

    private static final Map<ContributionStep, Set<ContributionStep>> TRANSITIONS = new EnumMap<>(ContributionStep.class);

    static {
        TRANSITIONS.put(ContributionStep.SELECTION, EnumSet.of(ContributionStep.CONTRIBUTION, ContributionStep.CLOSED));
        TRANSITIONS.put(ContributionStep.CONTRIBUTION,
                EnumSet.of(ContributionStep.SELECTION, ContributionStep.REVIEW, ContributionStep.CLOSED));
        TRANSITIONS.put(ContributionStep.REVIEW, EnumSet.of(ContributionStep.CONTRIBUTION, ContributionStep.CLOSED));
        TRANSITIONS.put(ContributionStep.CLOSED, EnumSet.noneOf(ContributionStep.class));
    }

    @Getter
    private final UUID id;

    @Getter
    private final UUID userId;

    private final ContributionDraft draft;

    @Getter
    @Setter
    private ContributionError error;

    @Getter
    @Setter
    private UUID contributionId;

    private final AtomicBoolean commitInFlight = new AtomicBoolean(false);
    private final List<ContributionSuccessListener> successListeners = new CopyOnWriteArrayList<>();

    private volatile Instant lastAccess;

    public ContributionSession(UUID id, UUID userId, Instant now) {
        this.id = id;
        this.userId = userId;
        this.draft = new ContributionDraft(UUID.randomUUID());
        this.lastAccess = now;
    }

    public ContributionDraft getDraft() {
        return draft;
    }

    public ContributionStep getStep() {
        return draft.getStep();
    }

    public static boolean isLegal(ContributionStep from, ContributionStep to) {
        return TRANSITIONS.get(from).contains(to);
    }

    public synchronized void moveTo(ContributionStep target) {
        ContributionStep current = draft.getStep();
        if (!isLegal(current, target)) {
            throw new ConflictException("Transição inválida: " + current.code() + " -> " + target.code());
        }
        draft.setStep(target);
    }

    public void requireStep(ContributionStep expected) {
        if (draft.getStep() != expected) {
            throw new ConflictException("Operação indisponível na etapa " + draft.getStep().code());
        }
    }

    public void requireIdle() {
        if (commitInFlight.get()) {
            throw new ConflictException("Contribuição em processamento, aguarde");
        }
        if (draft.getStep() == ContributionStep.CLOSED) {
            throw new ConflictException("Fluxo de contribuição encerrado");
        }
    }

    public boolean beginCommit() {
        return commitInFlight.compareAndSet(false, true);
    }

    public void endCommit() {
        commitInFlight.set(false);
    }

    public boolean isBusy() {
        return commitInFlight.get();
    }

    public boolean isClosed() {
        return draft.getStep() == ContributionStep.CLOSED;
    }

    public void addSuccessListener(ContributionSuccessListener listener) {
        successListeners.add(listener);
    }

    public List<ContributionSuccessListener> getSuccessListeners() {
        return List.copyOf(successListeners);
    }

    public void touch(Instant now) {
        this.lastAccess = now;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !isBusy() && lastAccess.plus(ttl).isBefore(now);
    }
}
