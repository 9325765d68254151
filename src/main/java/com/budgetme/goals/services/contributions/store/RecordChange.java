package com.budgetme.goals.services.contributions.store;

import java.util.Map;
import java.util.UUID;

/**
 * Notificação de que um registro mudou. Carrega só as colunas usadas para
 * filtragem; quem recebe deve reler o valor autoritativo.
 */
public record RecordChange(
        ChangeTable table,
        ChangeType type,
        UUID recordId,
        Map<String, Object> columns
) {
    public RecordChange {
        columns = columns == null ? Map.of() : Map.copyOf(columns);
    }

    public Object column(String name) {
        return columns.get(name);
    }
}
