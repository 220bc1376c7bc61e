package com.codefactory.guard.decision;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import com.codefactory.guard.model.Decision;
import com.codefactory.guard.model.SafetyCheck;
import com.codefactory.guard.rules.PatternMatch;
import com.codefactory.guard.rules.Rule;
import com.codefactory.guard.rules.Severity;
import com.codefactory.guard.semantic.SemanticFlag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionAggregatorTest {
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    private static final Rule HACK = new Rule("hack", 1, Severity.CRITICAL, "unauthorized-access",
            Pattern.compile("hack"), "Hacking or unauthorized access", null);
    private static final Rule MALWARE = new Rule("malware", 1, Severity.CRITICAL, "malware",
            Pattern.compile("malware"), "Malware development", null);
    private static final Rule SEND_EMAIL = new Rule("send-email", 1, Severity.CONFIRM, "outbound-email",
            Pattern.compile("send email"), "Email sending", "This will send email. Proceed?");
    private static final Rule NOTIFY = new Rule("notify", 1, Severity.CONFIRM, "outbound-email",
            Pattern.compile("notify"), "Notification", "This will send email. Proceed?");

    private final DecisionAggregator aggregator = new DecisionAggregator(
            new ConfidenceScorer(PenaltyWeights.defaults()), 0.5, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldApproveCleanEvidence() {
        Evidence evidence = new Evidence("Parse alarm logs", "parse alarm logs");

        SafetyCheck check = aggregator.decide(evidence);

        assertTrue(check.approved());
        assertEquals(Decision.APPROVED, check.decision());
        assertEquals(1.0, check.confidenceScore());
        assertTrue(check.warnings().isEmpty());
        assertEquals(NOW, check.metadata().timestamp());
        assertNotNull(check.metadata().requestId());
    }

    @Test
    void shouldBlockOnCriticalMatchRegardlessOfConfidence() {
        Evidence evidence = new Evidence("hack and malware", "hack and malware");
        evidence.recordPatternMatch(new PatternMatch(List.of(HACK, MALWARE), List.of(SEND_EMAIL)));

        SafetyCheck check = aggregator.decide(evidence);

        assertFalse(check.approved());
        assertEquals(Decision.BLOCKED, check.decision());
        assertEquals(1.0, check.confidenceScore());
        assertEquals(Set.of("unauthorized-access", "malware"), check.blockedKeywords());
        assertTrue(check.requiredConfirmations().isEmpty());
        assertTrue(check.warnings().contains(
                "BLOCKED: Dangerous operation detected - Hacking or unauthorized access (rule: hack)"));
        assertTrue(check.warnings().contains(DecisionAggregator.GUIDELINES_NOTICE));
        assertEquals(List.of("hack", "malware", "send-email"), check.metadata().patternsMatched());
    }

    @Test
    void shouldRequireConfirmationWithDistinctPrompts() {
        Evidence evidence = new Evidence("send email and notify", "send email and notify");
        evidence.recordPatternMatch(new PatternMatch(List.of(), List.of(SEND_EMAIL, NOTIFY)));

        SafetyCheck check = aggregator.decide(evidence);

        assertFalse(check.approved());
        assertTrue(check.requiresConfirmation());
        assertEquals(List.of("This will send email. Proceed?"), check.requiredConfirmations());
    }

    @Test
    void shouldRequireConfirmationEvenWhenConfidenceIsLow() {
        Evidence evidence = new Evidence("x", "x");
        evidence.recordPatternMatch(new PatternMatch(List.of(), List.of(SEND_EMAIL)));
        evidence.recordBypassAttempts(List.of("leetspeak", "case-mixing", "symbol-density"));

        SafetyCheck check = aggregator.decide(evidence);

        assertEquals(Decision.CONFIRM_REQUIRED, check.decision());
        assertEquals(0.4, check.confidenceScore());
    }

    @Test
    void shouldBlockWhenConfidenceFallsBelowThreshold() {
        Evidence evidence = new Evidence("w1pe and crash", "wipe and crash");
        evidence.recordBypassAttempts(List.of("leetspeak", "leetspeak"));
        evidence.recordSemanticFlags(List.of(
                new SemanticFlag(SemanticFlag.Type.DESTRUCTIVE_VERB, "wipe"),
                new SemanticFlag(SemanticFlag.Type.DESTRUCTIVE_VERB, "crash"),
                new SemanticFlag(SemanticFlag.Type.NO_SAFE_OPERATION, "")));
        evidence.recordWhitelistViolations(List.of("Unapproved operation: wipe"));

        SafetyCheck check = aggregator.decide(evidence);

        assertEquals(Decision.BLOCKED, check.decision());
        assertEquals(0.45, check.confidenceScore());
        assertEquals("BLOCKED: " + DecisionAggregator.INSUFFICIENT_CONFIDENCE, check.warnings().get(0));
        assertTrue(check.warnings().contains("Warning: Destructive action detected: wipe"));
        assertTrue(check.warnings().contains("Note: Unapproved operation: wipe"));
        assertEquals(Set.of("leetspeak"), check.metadata().bypassAttemptsDetected());
        assertEquals(List.of("destructive-verb:wipe", "destructive-verb:crash", "no-safe-operation"),
                check.metadata().semanticFlags());
    }

    @Test
    void shouldBlockEmptyText() {
        SafetyCheck check = aggregator.decide(new Evidence("   ", ""));

        assertEquals(Decision.BLOCKED, check.decision());
        assertEquals(0.0, check.confidenceScore());
        assertTrue(check.warnings().contains("BLOCKED: request text is empty after normalization"));
    }

    @Test
    void shouldBlockEmptyTextWithZeroThresholdAndZeroEmptyWeight() {
        DecisionAggregator lenient = new DecisionAggregator(
                new ConfidenceScorer(new PenaltyWeights(0.2, 0.1, 0.05, 0.0)), 0.0, Clock.fixed(NOW, ZoneOffset.UTC));

        SafetyCheck check = lenient.decide(new Evidence("", ""));

        assertFalse(check.approved());
        assertEquals(Decision.BLOCKED, check.decision());
        assertEquals(1.0, check.confidenceScore());
        assertTrue(check.warnings().contains("BLOCKED: " + DecisionAggregator.EMPTY_REQUEST));
    }

    @Test
    void shouldApproveWithWarningsAboveThreshold() {
        Evidence evidence = new Evidence("send alerts", "send alerts");
        evidence.recordSemanticFlags(List.of(new SemanticFlag(SemanticFlag.Type.NO_SAFE_OPERATION, "")));
        evidence.recordWhitelistViolations(List.of("Unapproved operation: send"));

        SafetyCheck check = aggregator.decide(evidence);

        assertTrue(check.approved());
        assertEquals(0.85, check.confidenceScore());
        assertEquals(List.of("Warning: No clearly approved operation detected", "Note: Unapproved operation: send"),
                check.warnings());
    }

    @Test
    void shouldRejectThresholdOutsideUnitInterval() {
        ConfidenceScorer scorer = new ConfidenceScorer(PenaltyWeights.defaults());

        assertThrows(IllegalArgumentException.class, () -> new DecisionAggregator(scorer, 1.5, Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class, () -> new DecisionAggregator(scorer, -0.1, Clock.systemUTC()));
    }
}
