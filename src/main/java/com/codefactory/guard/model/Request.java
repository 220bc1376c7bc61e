package com.codefactory.guard.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Request(
        String description,
        List<String> targetUsers,
        String environment,
        List<String> features,
        List<String> constraints) {

    public Request {
        description = description == null ? "" : description;
        targetUsers = withoutNulls(targetUsers);
        features = withoutNulls(features);
        constraints = withoutNulls(constraints);
    }

    private static List<String> withoutNulls(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public static Request of(String description) {
        return new Request(description, List.of(), null, List.of(), List.of());
    }

    public String analyzedText() {
        List<String> parts = new ArrayList<>();
        parts.add(description);
        parts.addAll(features);
        parts.addAll(constraints);
        if (environment != null && !environment.isBlank()) {
            parts.add(environment);
        }
        return String.join(" ", parts);
    }
}
