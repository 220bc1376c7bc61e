package com.codefactory.guard.model;

public enum Decision {
    PENDING,
    BLOCKED,
    CONFIRM_REQUIRED,
    APPROVED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
