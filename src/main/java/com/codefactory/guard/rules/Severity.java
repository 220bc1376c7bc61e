package com.codefactory.guard.rules;

public enum Severity {
    CRITICAL,
    CONFIRM
}
