package com.budgetme.goals.dto.contribution;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class SelectAccountRequestDTO {

    @NotNull(message = "A conta é obrigatória")
    private UUID accountId;
}
