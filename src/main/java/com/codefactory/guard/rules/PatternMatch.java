package com.codefactory.guard.rules;

import java.util.List;
import java.util.stream.Stream;

public record PatternMatch(List<Rule> critical, List<Rule> confirm) {

    public PatternMatch {
        critical = List.copyOf(critical);
        confirm = List.copyOf(confirm);
    }

    public static PatternMatch none() {
        return new PatternMatch(List.of(), List.of());
    }

    public List<String> criticalIds() {
        return critical.stream().map(Rule::id).toList();
    }

    public List<String> confirmIds() {
        return confirm.stream().map(Rule::id).toList();
    }

    public List<String> allIds() {
        return Stream.concat(critical.stream(), confirm.stream()).map(Rule::id).toList();
    }

    public boolean hasCritical() {
        return !critical.isEmpty();
    }

    public boolean hasConfirm() {
        return !confirm.isEmpty();
    }
}
