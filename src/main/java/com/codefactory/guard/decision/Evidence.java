package com.codefactory.guard.decision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.codefactory.guard.rules.PatternMatch;
import com.codefactory.guard.semantic.SemanticFlag;

public final class Evidence {
    private final String rawText;
    private final String normalizedText;
    private final List<String> patternsMatched = new ArrayList<>();
    private final Set<String> bypassAttemptsDetected = new LinkedHashSet<>();
    private final List<String> semanticFlags = new ArrayList<>();
    private final List<String> semanticMessages = new ArrayList<>();
    private final List<String> whitelistViolations = new ArrayList<>();
    private final List<EvidenceItem> items = new ArrayList<>();
    private PatternMatch patternMatch = PatternMatch.none();

    public Evidence(String rawText, String normalizedText) {
        this.rawText = rawText == null ? "" : rawText;
        this.normalizedText = normalizedText == null ? "" : normalizedText;
        if (this.normalizedText.isEmpty()) {
            items.add(new EvidenceItem(EvidenceKind.EMPTY_REQUEST, "request text is empty after normalization"));
        }
    }

    public void recordPatternMatch(PatternMatch match) {
        this.patternMatch = match;
        patternsMatched.addAll(match.allIds());
    }

    public void recordBypassAttempts(Collection<String> techniques) {
        for (String technique : techniques) {
            if (bypassAttemptsDetected.add(technique)) {
                items.add(new EvidenceItem(EvidenceKind.BYPASS_ATTEMPT, technique));
            }
        }
    }

    public void recordSemanticFlags(Collection<SemanticFlag> flags) {
        for (SemanticFlag flag : flags) {
            semanticFlags.add(flag.label());
            semanticMessages.add(flag.message());
            items.add(new EvidenceItem(EvidenceKind.SEMANTIC_FLAG, flag.label()));
        }
    }

    public void recordWhitelistViolations(Collection<String> violations) {
        for (String violation : violations) {
            whitelistViolations.add(violation);
            items.add(new EvidenceItem(EvidenceKind.WHITELIST_VIOLATION, violation));
        }
    }

    public String rawText() {
        return rawText;
    }

    public String normalizedText() {
        return normalizedText;
    }

    public PatternMatch patternMatch() {
        return patternMatch;
    }

    public List<String> patternsMatched() {
        return Collections.unmodifiableList(patternsMatched);
    }

    public Set<String> bypassAttemptsDetected() {
        return Collections.unmodifiableSet(bypassAttemptsDetected);
    }

    public List<String> semanticFlags() {
        return Collections.unmodifiableList(semanticFlags);
    }

    List<String> semanticMessages() {
        return Collections.unmodifiableList(semanticMessages);
    }

    public List<String> whitelistViolations() {
        return Collections.unmodifiableList(whitelistViolations);
    }

    public List<EvidenceItem> items() {
        return Collections.unmodifiableList(items);
    }
}
