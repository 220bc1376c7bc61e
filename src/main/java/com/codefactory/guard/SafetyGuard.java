package com.codefactory.guard;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.audit.AuditSink;
import com.codefactory.guard.audit.AuditSinks;
import com.codefactory.guard.decision.ConfidenceScorer;
import com.codefactory.guard.decision.DecisionAggregator;
import com.codefactory.guard.decision.Evidence;
import com.codefactory.guard.model.AuditRecord;
import com.codefactory.guard.model.Decision;
import com.codefactory.guard.model.Request;
import com.codefactory.guard.model.SafetyCheck;
import com.codefactory.guard.normalize.TextNormalizer;
import com.codefactory.guard.policy.PolicyLoader;
import com.codefactory.guard.policy.PolicyTables;
import com.codefactory.guard.rules.BypassDetector;
import com.codefactory.guard.rules.PatternMatch;
import com.codefactory.guard.rules.PatternMatcher;
import com.codefactory.guard.runtime.GuardConfig;
import com.codefactory.guard.semantic.SemanticAnalyzer;
import com.codefactory.guard.whitelist.WhitelistResult;
import com.codefactory.guard.whitelist.WhitelistValidator;

import okhttp3.OkHttpClient;

/**
 * Entry point of the request guard: runs normalization, pattern matching, semantic analysis and whitelist
 * validation over a request, reduces the evidence to a {@link SafetyCheck} and appends the audit record.
 *
 * <p>{@link #evaluate(Request)} never throws. An unexpected failure inside the pipeline produces a blocked
 * result, and a failing audit sink is reported to the log without affecting the decision. Instances are
 * thread-safe.
 */
public class SafetyGuard {
    private static final Logger log = LoggerFactory.getLogger(SafetyGuard.class);

    private final TextNormalizer normalizer;
    private final PatternMatcher patternMatcher;
    private final SemanticAnalyzer semanticAnalyzer;
    private final WhitelistValidator whitelistValidator;
    private final DecisionAggregator aggregator;
    private final AuditSink auditSink;
    private final Clock clock;
    private final AtomicLong auditFailures = new AtomicLong();

    public SafetyGuard(
            TextNormalizer normalizer,
            PatternMatcher patternMatcher,
            SemanticAnalyzer semanticAnalyzer,
            WhitelistValidator whitelistValidator,
            DecisionAggregator aggregator,
            AuditSink auditSink,
            Clock clock) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.patternMatcher = Objects.requireNonNull(patternMatcher, "patternMatcher");
        this.semanticAnalyzer = Objects.requireNonNull(semanticAnalyzer, "semanticAnalyzer");
        this.whitelistValidator = Objects.requireNonNull(whitelistValidator, "whitelistValidator");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static SafetyGuard fromConfig(GuardConfig config, OkHttpClient httpClient) {
        config.validate();
        PolicyTables tables = config.getPolicyPath() == null || config.getPolicyPath().isBlank()
                ? PolicyTables.defaults()
                : new PolicyLoader().load(Path.of(config.getPolicyPath()));
        return create(config, tables, AuditSinks.fromConfig(config.getAudit(), httpClient), Clock.systemUTC());
    }

    public static SafetyGuard create(GuardConfig config, PolicyTables tables, AuditSink auditSink, Clock clock) {
        config.validate();
        TextNormalizer normalizer = config.isLeetspeakEnabled()
                ? new TextNormalizer(tables.leetspeak())
                : new TextNormalizer();
        return new SafetyGuard(
                normalizer,
                new PatternMatcher(tables.rules(), new BypassDetector(tables.leetspeak())),
                new SemanticAnalyzer(tables.lexicon(), tables.whitelist(), normalizer),
                new WhitelistValidator(tables.whitelist()),
                new DecisionAggregator(
                        new ConfidenceScorer(config.getPenalties().toWeights()),
                        config.getConfidenceThreshold(),
                        clock),
                auditSink,
                clock);
    }

    public SafetyCheck evaluate(Request request) {
        SafetyCheck result;
        try {
            result = runPipeline(request == null ? Request.of("") : request);
        } catch (RuntimeException e) {
            log.error("Safety evaluation failed unexpectedly; blocking request", e);
            result = failClosed(request, e);
        }
        appendAudit(result.metadata());
        return result;
    }

    private SafetyCheck runPipeline(Request request) {
        String raw = request.analyzedText();
        log.info("Safety check initiated for: {}", abbreviate(request.description(), 50));
        log.info("Full input length: {} characters", raw.length());

        String normalized = normalizer.normalize(raw);
        log.debug("Normalized text: {}", abbreviate(normalized, 100));
        Evidence evidence = new Evidence(raw, normalized);

        PatternMatch match = patternMatcher.match(normalized);
        evidence.recordPatternMatch(match);
        evidence.recordBypassAttempts(patternMatcher.detectBypassAttempts(raw, normalized));

        // the verdict is fixed once a critical rule fired; the remaining stages only complete the audit trail
        evidence.recordSemanticFlags(semanticAnalyzer.analyze(normalized, request, match.confirmIds()));
        WhitelistResult whitelist = whitelistValidator.validate(normalized);
        evidence.recordWhitelistViolations(whitelist.violations());
        log.debug("Whitelist categories matched: {}", whitelist.matchedCategories());

        return aggregator.decide(evidence);
    }

    private SafetyCheck failClosed(Request request, RuntimeException failure) {
        String raw = request == null ? "" : request.analyzedText();
        String reason = "BLOCKED: internal error during safety evaluation ("
                + failure.getClass().getSimpleName() + "); request could not be verified";
        AuditRecord record = new AuditRecord(
                UUID.randomUUID().toString(),
                clock.instant(),
                raw,
                "",
                List.of(),
                Set.of(),
                List.of(),
                List.of(),
                0.0,
                false,
                Decision.BLOCKED);
        return new SafetyCheck(false, Decision.BLOCKED, List.of(reason), List.of(), Set.of(), 0.0, record);
    }

    private void appendAudit(AuditRecord record) {
        try {
            auditSink.append(record);
        } catch (Exception e) {
            long failures = auditFailures.incrementAndGet();
            log.warn("Unable to append audit record {} to {} (failures so far: {})",
                    record.requestId(), auditSink.name(), failures, e);
        }
    }

    /** Number of audit records that could not be written since this guard was created. */
    public long auditFailureCount() {
        return auditFailures.get();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
