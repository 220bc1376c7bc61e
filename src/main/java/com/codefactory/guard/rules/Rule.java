package com.codefactory.guard.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public record Rule(
        String id,
        int version,
        Severity severity,
        String category,
        Pattern pattern,
        String description,
        String prompt) {

    public Rule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(pattern, "pattern");
        category = category == null ? "uncategorized" : category;
        description = description == null || description.isBlank() ? id : description;
        prompt = prompt == null || prompt.isBlank()
                ? "This request may involve " + description.toLowerCase(Locale.ROOT) + ". Proceed?"
                : prompt;
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
