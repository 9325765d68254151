package com.budgetme.goals.exceptions;

/**
 * Falha de infraestrutura ao acessar o armazenamento (conexão, timeout, lock).
 * Nunca usada para regras de negócio; "não encontrado" é {@code Optional.empty()}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
