package com.codefactory.guard.whitelist;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.normalize.Tokens;

/**
 * Checks that the operation a request leads with belongs to an approved category. Deliberately permissive:
 * a violation lowers confidence but never blocks on its own.
 */
public class WhitelistValidator {
    private static final Logger log = LoggerFactory.getLogger(WhitelistValidator.class);

    private static final Set<String> FILLER = Set.of(
            "a", "an", "the", "please", "i", "we", "you", "me", "us", "my", "our", "want", "wants", "need", "needs",
            "would", "like", "could", "can", "should", "will", "let", "lets", "just", "simply", "also", "kindly",
            "to", "that", "which", "who", "for", "quickly", "automatically", "new", "simple", "small");
    private static final Set<String> FRAMING_NOUNS = Set.of(
            "tool", "app", "application", "program", "script", "service", "utility", "bot", "dashboard", "website",
            "site", "page", "cli", "module", "library", "system", "platform", "solution", "widget", "plugin",
            "function", "way", "something", "project", "feature", "api");
    private static final Set<String> CONNECTIVES = Set.of("to", "that", "which", "for", "who");

    private final OperationWhitelist whitelist;

    public WhitelistValidator(OperationWhitelist whitelist) {
        this.whitelist = whitelist;
    }

    public WhitelistResult validate(String normalized) {
        List<String> words = Tokens.words(normalized);
        Set<String> matched = new LinkedHashSet<>();
        for (String word : words) {
            matched.addAll(whitelist.categoriesOf(word));
        }

        List<String> violations = new ArrayList<>();
        String head = headVerb(words);
        if (head != null && !whitelist.isApproved(head)) {
            violations.add("Unapproved operation: " + head);
            log.info("Whitelist check: head operation '{}' is not in an approved category", head);
        }
        return new WhitelistResult(matched, violations, head);
    }

    /**
     * Heuristic grammatical head: the first token after leading filler, or, when the request opens with a
     * framing noun ("a tool to read ..."), the first token after the following connective.
     */
    static String headVerb(List<String> words) {
        int i = skipFiller(words, 0);
        if (i >= words.size()) {
            return null;
        }
        if (FRAMING_NOUNS.contains(words.get(i))) {
            int connective = -1;
            for (int j = i + 1; j < words.size(); j++) {
                if (CONNECTIVES.contains(words.get(j))) {
                    connective = j;
                    break;
                }
            }
            if (connective < 0) {
                return null;
            }
            i = skipFiller(words, connective + 1);
            if (i >= words.size()) {
                return null;
            }
        }
        return words.get(i);
    }

    private static int skipFiller(List<String> words, int from) {
        int i = from;
        while (i < words.size() && (FILLER.contains(words.get(i)) || !hasLetter(words.get(i)))) {
            i++;
        }
        return i;
    }

    private static boolean hasLetter(String word) {
        return word.chars().anyMatch(Character::isLetter);
    }
}
