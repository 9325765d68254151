package com.budgetme.goals.services.contributions.store;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Distribui {@link RecordChange} para as assinaturas registradas.
 * As mudanças só são entregues depois do commit da transação que as gerou;
 * escritas revertidas não notificam ninguém.
 */
@Slf4j
@Component
public class RealtimeChangeFeed {

    private final Set<StoreSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    public StoreSubscription subscribe(ChangeTable table, ChangeFilter filter, Consumer<RecordChange> onChange) {
        StoreSubscription subscription = new StoreSubscription(table, filter, onChange);
        subscriptions.add(subscription);
        log.debug("[ChangeFeed] Assinatura criada: {}", subscription);
        return subscription;
    }

    public void unsubscribe(StoreSubscription subscription) {
        if (subscription != null && subscriptions.remove(subscription)) {
            log.debug("[ChangeFeed] Assinatura removida: {}", subscription);
        }
    }

    public int activeSubscriptions() {
        return subscriptions.size();
    }

    @Async("realtimeTaskExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onRecordChanged(RecordChange change) {
        for (StoreSubscription subscription : subscriptions) {
            if (!subscription.accepts(change)) {
                continue;
            }
            try {
                subscription.deliver(change);
            } catch (Exception e) {
                // um assinante com problema não impede os demais
                log.error("[ChangeFeed] Falha ao entregar {} {} para {}",
                        change.table(), change.type(), subscription, e);
            }
        }
    }
}
