package com.codefactory.guard.semantic;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.model.Request;
import com.codefactory.guard.normalize.TextNormalizer;
import com.codefactory.guard.normalize.Tokens;
import com.codefactory.guard.whitelist.OperationWhitelist;

/**
 * Reports intent signals that single regular expressions cannot express. Flags carry no weight here; the
 * aggregator turns them into confidence penalties.
 */
public class SemanticAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final IntentLexicon lexicon;
    private final OperationWhitelist whitelist;
    private final TextNormalizer normalizer;

    public SemanticAnalyzer(IntentLexicon lexicon, OperationWhitelist whitelist, TextNormalizer normalizer) {
        this.lexicon = lexicon;
        this.whitelist = whitelist;
        this.normalizer = normalizer;
    }

    public List<SemanticFlag> analyze(String normalized) {
        return analyze(normalized, null, List.of());
    }

    /**
     * @param request          the originating request, used for its environment and target users; may be null
     * @param confirmRuleIds   confirm rules that matched, candidates for privileged-context amplification
     */
    public List<SemanticFlag> analyze(String normalized, Request request, List<String> confirmRuleIds) {
        List<String> words = Tokens.words(normalized);
        List<SemanticFlag> flags = new ArrayList<>();

        for (String verb : lexicon.destructiveVerbs()) {
            if (Tokens.containsStem(words, verb)) {
                flags.add(new SemanticFlag(SemanticFlag.Type.DESTRUCTIVE_VERB, verb));
            }
        }
        for (RiskyPair pair : lexicon.riskyPairs()) {
            if (Tokens.containsStem(words, pair.first()) && Tokens.containsStem(words, pair.second())) {
                flags.add(new SemanticFlag(SemanticFlag.Type.RISKY_COMBINATION, pair.label()));
            }
        }
        String context = privilegedContext(request);
        if (context != null) {
            for (String ruleId : confirmRuleIds) {
                flags.add(new SemanticFlag(SemanticFlag.Type.PRIVILEGED_CONTEXT, ruleId + "@" + context));
            }
        }
        if (!whitelist.containsApprovedOperation(words)) {
            flags.add(new SemanticFlag(SemanticFlag.Type.NO_SAFE_OPERATION, ""));
        }

        flags.forEach(flag -> log.warn("Semantic flag: {}", flag.label()));
        return flags;
    }

    private String privilegedContext(Request request) {
        if (request == null) {
            return null;
        }
        List<String> hints = new ArrayList<>(request.targetUsers());
        if (request.environment() != null) {
            hints.add(request.environment());
        }
        List<String> words = Tokens.words(normalizer.normalize(String.join(" ", hints)));
        return lexicon.privilegedContexts().stream()
                .filter(term -> Tokens.containsStem(words, term))
                .findFirst()
                .orElse(null);
    }
}
