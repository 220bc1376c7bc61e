package com.codefactory.guard.whitelist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codefactory.guard.normalize.Tokens;

public final class OperationWhitelist {
    private final Map<String, List<String>> categories;

    public OperationWhitelist(Map<String, List<String>> categories) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        categories.forEach((category, stems) -> copy.put(category, List.copyOf(stems)));
        this.categories = Collections.unmodifiableMap(copy);
    }

    public Map<String, List<String>> categories() {
        return categories;
    }

    public Set<String> categoriesOf(String word) {
        Set<String> matched = new LinkedHashSet<>();
        categories.forEach((category, stems) -> {
            if (stems.stream().anyMatch(stem -> Tokens.matchesStem(word, stem))) {
                matched.add(category);
            }
        });
        return matched;
    }

    public boolean isApproved(String word) {
        return !categoriesOf(word).isEmpty();
    }

    public boolean containsApprovedOperation(List<String> words) {
        return words.stream().anyMatch(this::isApproved);
    }
}
