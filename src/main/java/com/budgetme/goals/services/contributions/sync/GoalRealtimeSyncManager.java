package com.budgetme.goals.services.contributions.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.budgetme.goals.dto.sync.GoalSnapshotDTO;
import com.budgetme.goals.entities.Goal;
import com.budgetme.goals.entities.GoalContribution;
import com.budgetme.goals.mappers.GoalContributionMapper;
import com.budgetme.goals.services.contributions.store.ChangeFilter;
import com.budgetme.goals.services.contributions.store.ChangeTable;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import com.budgetme.goals.services.contributions.store.RecordChange;
import com.budgetme.goals.services.contributions.store.StoreSubscription;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mantém as views de metas atualizadas.
 * <p>
 * Um canal por meta, com três assinaturas no armazenamento (meta, contribuições e
 * lançamentos da meta). Qualquer mudança, venha de onde vier, dispara uma releitura
 * e o resultado é publicado para todas as views do canal. Quando a última view sai,
 * as assinaturas são canceladas.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoalRealtimeSyncManager {

    private final ContributionStore store;

    private final Map<UUID, GoalChannel> channels = new ConcurrentHashMap<>();

    /**
     * Registra a view no canal da meta. Chamar de novo com a mesma view não
     * duplica nada.
     */
    public synchronized void subscribe(UUID goalId, UUID userId, GoalViewListener view) {
        GoalChannel channel = channels.get(goalId);
        if (channel == null) {
            channel = openChannel(goalId);
            channels.put(goalId, channel);
        }
        if (channel.views.putIfAbsent(view, userId) == null) {
            log.debug("[GoalSync] View adicionada à meta {} (total {})", goalId, channel.views.size());
        }
    }

    public synchronized void unsubscribe(UUID goalId, GoalViewListener view) {
        GoalChannel channel = channels.get(goalId);
        if (channel == null) {
            return;
        }
        channel.views.remove(view);
        if (channel.views.isEmpty()) {
            closeChannel(channel);
            channels.remove(goalId);
        }
    }

    /** Desmontagem da view: sai de todos os canais. */
    public synchronized void teardown(GoalViewListener view) {
        for (UUID goalId : new ArrayList<>(channels.keySet())) {
            unsubscribe(goalId, view);
        }
    }

    /** Sinal de "janela voltou ao foco": relê todas as metas que o usuário está vendo. */
    public void onWindowRefocused(UUID userId) {
        List<UUID> goalIds = channels.values().stream()
                .filter(channel -> channel.views.containsValue(userId))
                .map(channel -> channel.goalId)
                .toList();
        log.debug("[GoalSync] Refoco do usuário {}: relendo {} meta(s)", userId, goalIds.size());
        goalIds.forEach(this::refresh);
    }

    /** Relê a meta e publica para as views, se houver alguma. */
    public void refresh(UUID goalId) {
        GoalChannel channel = channels.get(goalId);
        if (channel == null || channel.views.isEmpty()) {
            return;
        }

        GoalSnapshotDTO snapshot;
        try {
            snapshot = fetchSnapshot(goalId);
        } catch (RuntimeException e) {
            // mantém o último estado; a próxima notificação ou refoco tenta de novo
            log.warn("[GoalSync] Falha ao reler meta {}: {}", goalId, e.getMessage());
            return;
        }

        for (GoalViewListener view : channel.views.keySet()) {
            try {
                view.onGoalRefreshed(snapshot);
            } catch (Exception e) {
                log.warn("[GoalSync] View falhou ao receber meta {}: {}", goalId, e.getMessage());
            }
        }
    }

    public GoalSnapshotDTO fetchSnapshot(UUID goalId) {
        Optional<Goal> goal = store.getGoal(goalId);
        if (goal.isEmpty()) {
            return GoalSnapshotDTO.removed(goalId.toString());
        }
        List<GoalContribution> contributions = store.getContributionsForGoal(goalId);
        GoalSnapshotDTO snapshot = GoalContributionMapper.toSnapshot(goal.get(), contributions);
        if (snapshot.overshoot()) {
            log.warn("[GoalSync] Meta {} acima do alvo: atual={} alvo={}",
                    goalId, snapshot.currentAmount(), snapshot.targetAmount());
        }
        return snapshot;
    }

    public boolean isSubscribed(UUID goalId, GoalViewListener view) {
        GoalChannel channel = channels.get(goalId);
        return channel != null && channel.views.containsKey(view);
    }

    public int activeChannels() {
        return channels.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        channels.values().forEach(this::closeChannel);
        channels.clear();
    }

    private GoalChannel openChannel(UUID goalId) {
        GoalChannel channel = new GoalChannel(goalId);
        channel.subscriptions.add(store.subscribeToChanges(
                ChangeTable.GOALS, ChangeFilter.eq("id", goalId), change -> onChange(goalId, change)));
        channel.subscriptions.add(store.subscribeToChanges(
                ChangeTable.GOAL_CONTRIBUTIONS, ChangeFilter.eq("goal_id", goalId), change -> onChange(goalId, change)));
        channel.subscriptions.add(store.subscribeToChanges(
                ChangeTable.TRANSACTIONS, ChangeFilter.eq("goal_id", goalId), change -> onChange(goalId, change)));
        log.info("[GoalSync] Canal aberto para meta {}", goalId);
        return channel;
    }

    private void closeChannel(GoalChannel channel) {
        channel.subscriptions.forEach(store::unsubscribe);
        channel.subscriptions.clear();
        log.info("[GoalSync] Canal fechado para meta {}", channel.goalId);
    }

    private void onChange(UUID goalId, RecordChange change) {
        log.debug("[GoalSync] {} {} em {} -> relendo meta {}", change.type(), change.recordId(), change.table(), goalId);
        refresh(goalId);
    }

    private static final class GoalChannel {
        private final UUID goalId;
        // view -> usuário dono da view
        private final Map<GoalViewListener, UUID> views = new ConcurrentHashMap<>();
        private final List<StoreSubscription> subscriptions = new ArrayList<>();

        private GoalChannel(UUID goalId) {
            this.goalId = goalId;
        }
    }
}
