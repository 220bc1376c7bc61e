package com.codefactory.guard.decision;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.model.AuditRecord;
import com.codefactory.guard.model.Decision;
import com.codefactory.guard.model.SafetyCheck;
import com.codefactory.guard.rules.PatternMatch;
import com.codefactory.guard.rules.Rule;

/**
 * Reduces one evaluation's evidence to a verdict.
 *
 * <p>Transitions out of {@link Decision#PENDING}, first applicable wins:
 * <ol>
 * <li>any critical rule matched: {@link Decision#BLOCKED}</li>
 * <li>any confirm rule matched: {@link Decision#CONFIRM_REQUIRED}</li>
 * <li>empty normalized text: {@link Decision#BLOCKED}, whatever the weights and threshold</li>
 * <li>confidence below the threshold: {@link Decision#BLOCKED}</li>
 * <li>otherwise {@link Decision#APPROVED}</li>
 * </ol>
 */
public class DecisionAggregator {
    public static final String INSUFFICIENT_CONFIDENCE = "insufficient confidence in request safety.";
    public static final String EMPTY_REQUEST = "request text is empty after normalization";
    static final String GUIDELINES_NOTICE = "Request violates safety guidelines. Only approved operations may proceed.";

    private static final Logger log = LoggerFactory.getLogger(DecisionAggregator.class);

    private final ConfidenceScorer scorer;
    private final double confidenceThreshold;
    private final Clock clock;

    public DecisionAggregator(ConfidenceScorer scorer, double confidenceThreshold, Clock clock) {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("Confidence threshold must be within [0.0, 1.0] (was " + confidenceThreshold + ")");
        }
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.confidenceThreshold = confidenceThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SafetyCheck decide(Evidence evidence) {
        PatternMatch match = evidence.patternMatch();
        double confidence = scorer.score(evidence.items());
        List<String> warnings = new ArrayList<>();
        List<String> confirmations = new ArrayList<>();
        Set<String> blockedKeywords = new LinkedHashSet<>();
        Decision decision = Decision.PENDING;

        if (match.hasCritical()) {
            decision = Decision.BLOCKED;
            for (Rule rule : match.critical()) {
                blockedKeywords.add(rule.category());
                warnings.add("BLOCKED: Dangerous operation detected - " + rule.description() + " (rule: " + rule.id() + ")");
                log.error("SECURITY VIOLATION: {} rule={} pattern={}", rule.description(), rule.id(), rule.pattern().pattern());
            }
        } else if (match.hasConfirm()) {
            decision = Decision.CONFIRM_REQUIRED;
            Set<String> prompts = new LinkedHashSet<>();
            for (Rule rule : match.confirm()) {
                prompts.add(rule.prompt());
                log.warn("Confirmation required: {} rule={}", rule.description(), rule.id());
            }
            confirmations.addAll(prompts);
        } else if (evidence.normalizedText().isEmpty()) {
            decision = Decision.BLOCKED;
            warnings.add("BLOCKED: " + EMPTY_REQUEST);
            log.error("Request text is empty after normalization");
        } else if (confidence < confidenceThreshold) {
            decision = Decision.BLOCKED;
            warnings.add("BLOCKED: " + INSUFFICIENT_CONFIDENCE);
            log.error("Confidence {} below threshold {}", String.format(Locale.ROOT, "%.2f", confidence), confidenceThreshold);
        } else {
            decision = Decision.APPROVED;
        }

        evidence.semanticMessages().forEach(message -> warnings.add("Warning: " + message));
        evidence.whitelistViolations().forEach(violation -> warnings.add("Note: " + violation));
        if (decision == Decision.BLOCKED) {
            warnings.add(GUIDELINES_NOTICE);
        }

        boolean approved = decision == Decision.APPROVED;
        AuditRecord record = new AuditRecord(
                UUID.randomUUID().toString(),
                clock.instant(),
                evidence.rawText(),
                evidence.normalizedText(),
                List.copyOf(evidence.patternsMatched()),
                Collections.unmodifiableSet(new LinkedHashSet<>(evidence.bypassAttemptsDetected())),
                List.copyOf(evidence.semanticFlags()),
                List.copyOf(evidence.whitelistViolations()),
                confidence,
                approved,
                decision);

        if (approved) {
            log.info("Safety check PASSED (confidence: {}, confirmations: {})", String.format(Locale.ROOT, "%.2f", confidence), confirmations.size());
        } else if (decision == Decision.CONFIRM_REQUIRED) {
            log.warn("Safety check requires confirmation: {}", match.confirmIds());
        } else {
            log.error("Safety check FAILED - {} critical violations detected, blocked categories: {}",
                    match.critical().size(), blockedKeywords);
        }

        return new SafetyCheck(
                approved,
                decision,
                List.copyOf(warnings),
                List.copyOf(confirmations),
                Collections.unmodifiableSet(blockedKeywords),
                confidence,
                record);
    }
}
