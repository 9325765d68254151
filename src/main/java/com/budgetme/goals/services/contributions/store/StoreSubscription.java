package com.budgetme.goals.services.contributions.store;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Handle devolvido por {@link ContributionStore#subscribeToChanges}. Deve ser
 * entregue a {@link ContributionStore#unsubscribe} quando a view for desmontada.
 */
public final class StoreSubscription {

    private final UUID id = UUID.randomUUID();
    private final ChangeTable table;
    private final ChangeFilter filter;
    private final Consumer<RecordChange> onChange;

    public StoreSubscription(ChangeTable table, ChangeFilter filter, Consumer<RecordChange> onChange) {
        this.table = table;
        this.filter = filter;
        this.onChange = onChange;
    }

    public UUID getId() {
        return id;
    }

    public ChangeTable getTable() {
        return table;
    }

    public ChangeFilter getFilter() {
        return filter;
    }

    boolean accepts(RecordChange change) {
        return table == change.table() && filter.matches(change);
    }

    void deliver(RecordChange change) {
        onChange.accept(change);
    }

    @Override
    public String toString() {
        return "StoreSubscription{" + table + ", " + filter + ", id=" + id + "}";
    }
}
