package com.codefactory.guard.whitelist;

import java.util.List;
import java.util.Set;

public record WhitelistResult(Set<String> matchedCategories, List<String> violations, String headVerb) {

    public WhitelistResult {
        matchedCategories = Set.copyOf(matchedCategories);
        violations = List.copyOf(violations);
    }
}
