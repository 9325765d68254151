package com.budgetme.goals.services;

import com.budgetme.goals.dto.contribution.GoalContributionResponseDTO;
import com.budgetme.goals.exceptions.ResourceNotFoundException;
import com.budgetme.goals.mappers.GoalContributionMapper;
import com.budgetme.goals.services.contributions.store.ContributionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class GoalContributionService {

    private final ContributionStore store;

    public List<GoalContributionResponseDTO> findByGoal(UUID goalId) {
        if (store.getGoal(goalId).isEmpty()) {
            throw new ResourceNotFoundException("Meta não encontrada");
        }
        return store.getContributionsForGoal(goalId).stream()
                .map(GoalContributionMapper::toResponseDTO)
                .toList();
    }
}
