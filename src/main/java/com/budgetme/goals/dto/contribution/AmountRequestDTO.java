package com.budgetme.goals.dto.contribution;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AmountRequestDTO {

    // texto livre; a validação do valor acontece ao avançar de etapa
    @Size(max = 32, message = "Valor muito longo")
    private String amount;
}
