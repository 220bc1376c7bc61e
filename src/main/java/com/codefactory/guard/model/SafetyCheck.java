package com.codefactory.guard.model;

import java.util.List;
import java.util.Set;

public record SafetyCheck(
        boolean approved,
        Decision decision,
        List<String> warnings,
        List<String> requiredConfirmations,
        Set<String> blockedKeywords,
        double confidenceScore,
        AuditRecord metadata) {

    public boolean requiresConfirmation() {
        return decision == Decision.CONFIRM_REQUIRED;
    }

    public boolean blocked() {
        return decision == Decision.BLOCKED;
    }
}
