package com.budgetme.goals.enums;

public enum Role {
    USER,
    ADMIN
}
