package com.budgetme.goals.services.contributions.sync;

import com.budgetme.goals.dto.sync.GoalSnapshotDTO;

/**
 * Uma view que exibe uma meta. Só recebe o valor relido; nunca deve aplicar
 * mudanças parciais por conta própria.
 */
public interface GoalViewListener {

    void onGoalRefreshed(GoalSnapshotDTO snapshot);
}
