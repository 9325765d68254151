package com.budgetme.goals.services.contributions.store;

import java.util.UUID;

public class DuplicateContributionException extends RuntimeException {

    private final UUID idempotencyKey;

    public DuplicateContributionException(UUID idempotencyKey) {
        super("Contribuição já registrada para a chave " + idempotencyKey);
        this.idempotencyKey = idempotencyKey;
    }

    public UUID getIdempotencyKey() {
        return idempotencyKey;
    }
}
