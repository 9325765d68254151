package com.budgetme.goals.services.contributions.store;

public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE
}
