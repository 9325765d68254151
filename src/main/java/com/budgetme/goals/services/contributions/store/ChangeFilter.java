package com.budgetme.goals.services.contributions.store;

import java.util.Objects;

/**
 * Filtro de igualdade sobre uma coluna, ex. {@code goal_id = <id>}.
 */
public record ChangeFilter(String column, Object value) {

    private static final ChangeFilter ANY = new ChangeFilter(null, null);

    public static ChangeFilter eq(String column, Object value) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
        return new ChangeFilter(column, value);
    }

    public static ChangeFilter any() {
        return ANY;
    }

    public boolean matches(RecordChange change) {
        if (column == null) {
            return true;
        }
        Object actual = "id".equals(column) ? change.recordId() : change.column(column);
        return value.equals(actual);
    }
}
