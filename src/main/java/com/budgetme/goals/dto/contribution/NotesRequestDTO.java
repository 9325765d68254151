package com.budgetme.goals.dto.contribution;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class NotesRequestDTO {

    @Size(max = 500, message = "A observação deve ter no máximo 500 caracteres")
    private String notes;
}
