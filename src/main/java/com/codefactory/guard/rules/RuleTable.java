package com.codefactory.guard.rules;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class RuleTable {
    private final List<Rule> critical;
    private final List<Rule> confirm;
    private final Map<String, Rule> byId;

    public RuleTable(List<Rule> rules) {
        Map<String, Rule> index = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (index.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.byId = Map.copyOf(index);
        this.critical = rules.stream().filter(rule -> rule.severity() == Severity.CRITICAL).toList();
        this.confirm = rules.stream().filter(rule -> rule.severity() == Severity.CONFIRM).toList();
    }

    public List<Rule> critical() {
        return critical;
    }

    public List<Rule> confirm() {
        return confirm;
    }

    public Optional<Rule> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return byId.size();
    }
}
