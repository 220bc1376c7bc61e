package com.codefactory.guard.decision;

public record PenaltyWeights(double bypassAttempt, double semanticFlag, double whitelistViolation, double emptyRequest) {

    public PenaltyWeights {
        requireNonNegative("bypassAttempt", bypassAttempt);
        requireNonNegative("semanticFlag", semanticFlag);
        requireNonNegative("whitelistViolation", whitelistViolation);
        requireNonNegative("emptyRequest", emptyRequest);
    }

    public static PenaltyWeights defaults() {
        return new PenaltyWeights(0.2, 0.1, 0.05, 1.0);
    }

    public double weightOf(EvidenceKind kind) {
        return switch (kind) {
            case BYPASS_ATTEMPT -> bypassAttempt;
            case SEMANTIC_FLAG -> semanticFlag;
            case WHITELIST_VIOLATION -> whitelistViolation;
            case EMPTY_REQUEST -> emptyRequest;
        };
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalArgumentException("Penalty weight " + name + " must be >= 0 (was " + value + ")");
        }
    }
}
