package com.codefactory.guard.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the critical and confirm rule sets against normalized text.
 *
 * <p>Besides the text itself, each rule is tried against two derived spellings: single-character runs rejoined
 * ({@code "c o n t r o l"} becomes {@code "control"}) and Cyrillic/Greek look-alikes folded to Latin. A rule
 * fires when any spelling matches, and every matching rule is reported in table order.
 */
public class PatternMatcher {
    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);
    private static final int MIN_SPLIT_RUN = 3;
    private static final Map<Character, Character> HOMOGLYPHS = Map.ofEntries(
            Map.entry('а', 'a'), Map.entry('е', 'e'), Map.entry('о', 'o'), Map.entry('р', 'p'),
            Map.entry('с', 'c'), Map.entry('у', 'y'), Map.entry('х', 'x'), Map.entry('і', 'i'),
            Map.entry('ј', 'j'), Map.entry('ѕ', 's'), Map.entry('һ', 'h'), Map.entry('ԁ', 'd'),
            Map.entry('ӏ', 'l'), Map.entry('к', 'k'), Map.entry('т', 't'), Map.entry('м', 'm'),
            Map.entry('α', 'a'), Map.entry('ο', 'o'), Map.entry('ρ', 'p'), Map.entry('ν', 'v'),
            Map.entry('ι', 'i'), Map.entry('κ', 'k'), Map.entry('τ', 't'), Map.entry('υ', 'u'),
            Map.entry('ε', 'e'), Map.entry('χ', 'x'));

    private final RuleTable rules;
    private final BypassDetector bypassDetector;

    public PatternMatcher(RuleTable rules, BypassDetector bypassDetector) {
        this.rules = rules;
        this.bypassDetector = bypassDetector;
    }

    public PatternMatch match(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return PatternMatch.none();
        }
        List<String> spellings = spellings(normalized);
        List<Rule> critical = matching(rules.critical(), spellings);
        List<Rule> confirm = matching(rules.confirm(), spellings);
        return new PatternMatch(critical, confirm);
    }

    public Set<String> detectBypassAttempts(String raw, String normalized) {
        Set<String> techniques = bypassDetector.detect(raw, normalized);
        if (!techniques.isEmpty()) {
            log.warn("Bypass techniques detected: {}", techniques);
        }
        return techniques;
    }

    private List<Rule> matching(List<Rule> candidates, List<String> spellings) {
        List<Rule> matched = new ArrayList<>();
        for (Rule rule : candidates) {
            if (spellings.stream().anyMatch(rule::matches)) {
                matched.add(rule);
                log.warn("Pattern match: '{}' rule={} severity={}", rule.description(), rule.id(), rule.severity());
            }
        }
        return matched;
    }

    static List<String> spellings(String normalized) {
        Set<String> spellings = new LinkedHashSet<>();
        spellings.add(normalized);
        String rejoined = rejoinSplitCharacters(normalized);
        spellings.add(rejoined);
        spellings.add(foldHomoglyphs(normalized));
        spellings.add(foldHomoglyphs(rejoined));
        return List.copyOf(spellings);
    }

    static String rejoinSplitCharacters(String normalized) {
        String[] tokens = normalized.split(" ");
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < tokens.length) {
            int end = i;
            while (end < tokens.length && isSingleCharacter(tokens[end])) {
                end++;
            }
            if (end - i >= MIN_SPLIT_RUN) {
                out.add(String.join("", Arrays.asList(tokens).subList(i, end)));
                i = end;
            } else {
                out.add(tokens[i]);
                i++;
            }
        }
        return String.join(" ", out);
    }

    static String foldHomoglyphs(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            builder.append(HOMOGLYPHS.getOrDefault(c, c));
        }
        return builder.toString();
    }

    static boolean isSingleCharacter(String token) {
        return token.length() == 1 && Character.isLetterOrDigit(token.charAt(0));
    }
}
