package com.codefactory.guard.normalize;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Digit/symbol substitution table. A token is rewritten only when it contains a letter, all of its digits
 * belong to the table, and the rewritten form is a word of the policy vocabulary, so {@code h4ck} becomes
 * {@code hack} while {@code log4j}, {@code mp3s} or {@code sha256} pass through.
 */
public final class LeetspeakTable {
    private static final Map<Character, Character> SUBSTITUTIONS = Map.of(
            '0', 'o',
            '3', 'e',
            '4', 'a',
            '$', 's');
    private static final int MIN_PREFIX_LENGTH = 5;

    private final List<String> vocabulary;

    private LeetspeakTable(List<String> vocabulary) {
        this.vocabulary = vocabulary;
    }

    public static LeetspeakTable forVocabulary(Collection<String> words) {
        return new LeetspeakTable(words.stream()
                .filter(word -> word != null && !word.isBlank())
                .map(word -> word.toLowerCase(Locale.ROOT))
                .distinct()
                .toList());
    }

    public String apply(String normalized) {
        if (normalized.isEmpty()) {
            return normalized;
        }
        String[] tokens = normalized.split(" ");
        StringBuilder out = new StringBuilder(normalized.length());
        for (int i = 0; i < tokens.length; i++) {
            if (i > 0) {
                out.append(' ');
            }
            out.append(decode(tokens[i]));
        }
        return out.toString();
    }

    public String decode(String token) {
        if (!eligible(token)) {
            return token;
        }
        String rewritten = rewrite(token);
        return isKnown(rewritten) ? rewritten : token;
    }

    private static boolean eligible(String token) {
        boolean hasLetter = false;
        boolean hasSubstitutable = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isLetter(c)) {
                hasLetter = true;
            } else if (c == '1' || SUBSTITUTIONS.containsKey(c)) {
                hasSubstitutable = true;
            } else if (Character.isDigit(c)) {
                return false;
            }
        }
        return hasLetter && hasSubstitutable;
    }

    private boolean isKnown(String word) {
        for (String known : vocabulary) {
            if (Tokens.matchesStem(word, known)
                    || (known.length() >= MIN_PREFIX_LENGTH && word.startsWith(known))) {
                return true;
            }
        }
        return false;
    }

    private static String rewrite(String token) {
        StringBuilder builder = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '1') {
                char previous = builder.length() == 0 ? ' ' : builder.charAt(builder.length() - 1);
                builder.append("aeioul".indexOf(previous) >= 0 ? 'l' : 'i');
            } else {
                builder.append(SUBSTITUTIONS.getOrDefault(c, c));
            }
        }
        return builder.toString();
    }
}
