package com.codefactory.guard.rules;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codefactory.guard.normalize.LeetspeakTable;

/**
 * Flags obfuscation techniques whether or not a rule fired. Raw text is inspected for signals that
 * normalization erases (invisible characters, case games, digit substitution), normalized text for the rest.
 */
public class BypassDetector {
    public static final String CHARACTER_SPLITTING = "character-splitting";
    public static final String SYMBOL_DENSITY = "symbol-density";
    public static final String MIXED_SCRIPT = "mixed-script";
    public static final String ZERO_WIDTH_INSERTION = "zero-width-insertion";
    public static final String CASE_MIXING = "case-mixing";
    public static final String LEETSPEAK = "leetspeak";

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF]");
    private static final Pattern LETTER_RUN = Pattern.compile("\\p{L}+");
    private static final Pattern LEET_TOKEN = Pattern.compile("[\\p{L}\\p{N}$]+");
    private static final int MIN_CASE_TRANSITIONS = 4;
    private static final int MIN_SYMBOLS = 6;
    private static final double MAX_SYMBOL_RATIO = 0.3;

    private final LeetspeakTable leetspeak;

    public BypassDetector(LeetspeakTable leetspeak) {
        this.leetspeak = leetspeak;
    }

    public Set<String> detect(String raw, String normalized) {
        Set<String> techniques = new LinkedHashSet<>();
        String original = raw == null ? "" : raw;
        String canonical = normalized == null ? "" : normalized;

        if (hasSplitCharacters(canonical)) {
            techniques.add(CHARACTER_SPLITTING);
        }
        if (excessiveSymbolDensity(original)) {
            techniques.add(SYMBOL_DENSITY);
        }
        if (hasMixedScriptToken(canonical)) {
            techniques.add(MIXED_SCRIPT);
        }
        if (ZERO_WIDTH.matcher(original).find()) {
            techniques.add(ZERO_WIDTH_INSERTION);
        }
        if (hasCaseMixing(original)) {
            techniques.add(CASE_MIXING);
        }
        if (hasLeetspeakToken(original)) {
            techniques.add(LEETSPEAK);
        }
        return techniques;
    }

    private boolean hasLeetspeakToken(String raw) {
        Matcher matcher = LEET_TOKEN.matcher(raw.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (!leetspeak.decode(token).equals(token)) {
                return true;
            }
        }
        return false;
    }

    static boolean hasSplitCharacters(String normalized) {
        int run = 0;
        for (String token : normalized.split(" ")) {
            run = PatternMatcher.isSingleCharacter(token) ? run + 1 : 0;
            if (run >= 3) {
                return true;
            }
        }
        return false;
    }

    static boolean excessiveSymbolDensity(String raw) {
        int symbols = 0;
        int visible = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            visible++;
            if (!Character.isLetterOrDigit(c)) {
                symbols++;
            }
        }
        return symbols >= MIN_SYMBOLS && (double) symbols / visible >= MAX_SYMBOL_RATIO;
    }

    static boolean hasMixedScriptToken(String normalized) {
        for (String token : normalized.split(" ")) {
            boolean latin = false;
            boolean other = false;
            for (int i = 0; i < token.length(); ) {
                int codePoint = token.codePointAt(i);
                i += Character.charCount(codePoint);
                if (!Character.isLetter(codePoint)) {
                    continue;
                }
                Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
                if (script == Character.UnicodeScript.LATIN) {
                    latin = true;
                } else if (script == Character.UnicodeScript.CYRILLIC || script == Character.UnicodeScript.GREEK) {
                    other = true;
                }
            }
            if (latin && other) {
                return true;
            }
        }
        return false;
    }

    static boolean hasCaseMixing(String raw) {
        Matcher matcher = LETTER_RUN.matcher(raw);
        while (matcher.find()) {
            String word = matcher.group();
            int transitions = 0;
            for (int i = 1; i < word.length(); i++) {
                if (Character.isUpperCase(word.charAt(i)) != Character.isUpperCase(word.charAt(i - 1))) {
                    transitions++;
                }
            }
            if (transitions >= MIN_CASE_TRANSITIONS) {
                return true;
            }
        }
        return false;
    }
}
