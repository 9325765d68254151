package com.budgetme.goals.enums;

public enum AuditEventStatus {
    SUCCESS,
    FAILURE
}
