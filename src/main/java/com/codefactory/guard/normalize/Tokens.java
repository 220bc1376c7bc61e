package com.codefactory.guard.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Tokens {
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final List<String> SUFFIXES = List.of("s", "es", "ed", "d", "ing", "er", "ers", "ion", "ions");

    private Tokens() {
    }

    public static List<String> words(String normalized) {
        List<String> words = new ArrayList<>();
        if (normalized == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(normalized);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    public static boolean matchesStem(String word, String stem) {
        if (word.equals(stem)) {
            return true;
        }
        if (!word.startsWith(stem.endsWith("e") ? stem.substring(0, stem.length() - 1) : stem)) {
            return false;
        }
        for (String suffix : SUFFIXES) {
            if (word.equals(stem + suffix)) {
                return true;
            }
            if (stem.endsWith("e") && word.equals(stem.substring(0, stem.length() - 1) + suffix)) {
                return true;
            }
            char last = stem.charAt(stem.length() - 1);
            if (suffix.startsWith("e") || suffix.startsWith("i")) {
                if (word.equals(stem + last + suffix)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean containsStem(List<String> words, String stem) {
        return words.stream().anyMatch(word -> matchesStem(word, stem));
    }
}
