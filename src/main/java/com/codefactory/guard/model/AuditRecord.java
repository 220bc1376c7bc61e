package com.codefactory.guard.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditRecord(
        String requestId,
        Instant timestamp,
        String rawText,
        String normalizedText,
        List<String> patternsMatched,
        Set<String> bypassAttemptsDetected,
        List<String> semanticFlags,
        List<String> whitelistViolations,
        double confidenceScore,
        boolean approved,
        Decision decision) {
}
