package com.budgetme.goals.dto.contribution;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class SelectGoalRequestDTO {

    @NotNull(message = "A meta é obrigatória")
    private UUID goalId;
}
