package com.codefactory.guard.semantic;

public record SemanticFlag(Type type, String detail) {

    public enum Type {
        DESTRUCTIVE_VERB("destructive-verb"),
        RISKY_COMBINATION("risky-combination"),
        PRIVILEGED_CONTEXT("privileged-context"),
        NO_SAFE_OPERATION("no-safe-operation");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public String label() {
        return detail == null || detail.isBlank() ? type.label() : type.label() + ":" + detail;
    }

    public String message() {
        return switch (type) {
            case DESTRUCTIVE_VERB -> "Destructive action detected: " + detail;
            case RISKY_COMBINATION -> "Risky keyword combination: " + detail.replace("+", " and ");
            case PRIVILEGED_CONTEXT -> "Operation requested in a privileged context: " + detail;
            case NO_SAFE_OPERATION -> "No clearly approved operation detected";
        };
    }
}
