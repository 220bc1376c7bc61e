package com.codefactory.guard.normalize;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes request text so that downstream matching sees one spelling of each word.
 *
 * <p>The transformation is total and idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public class TextNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[_\\-./\\\\|\\p{Cc}]");
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200B-\\u200F\\u202A-\\u202E\\u2060-\\u206F\\uFEFF]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");

    private final LeetspeakTable leetspeak;

    public TextNormalizer() {
        this(null);
    }

    // a null table skips the leetspeak pass
    public TextNormalizer(LeetspeakTable leetspeak) {
        this.leetspeak = leetspeak;
    }

    public String normalize(byte[] utf8) {
        if (utf8 == null) {
            return "";
        }
        // the String constructor substitutes U+FFFD for malformed sequences
        return normalize(new String(utf8, StandardCharsets.UTF_8));
    }

    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = stripMarks(Normalizer.normalize(dropLoneSurrogates(raw), Normalizer.Form.NFKD));
        text = stripMarks(Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD));
        text = INVISIBLE.matcher(text).replaceAll("");
        text = SEPARATORS.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        if (leetspeak != null) {
            text = leetspeak.apply(text);
        }
        return text;
    }

    public boolean leetspeakEnabled() {
        return leetspeak != null;
    }

    private static String stripMarks(String text) {
        return COMBINING_MARKS.matcher(text).replaceAll("");
    }

    private static String dropLoneSurrogates(String raw) {
        StringBuilder builder = null;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            boolean paired = Character.isHighSurrogate(c)
                    ? i + 1 < raw.length() && Character.isLowSurrogate(raw.charAt(i + 1))
                    : !Character.isLowSurrogate(c) || (i > 0 && Character.isHighSurrogate(raw.charAt(i - 1)));
            if (!paired) {
                if (builder == null) {
                    builder = new StringBuilder(raw.length()).append(raw, 0, i);
                }
                builder.append('\uFFFD');
            } else if (builder != null) {
                builder.append(c);
            }
        }
        return builder == null ? raw : builder.toString();
    }
}
