package com.codefactory.guard.decision;

import java.util.List;

public class ConfidenceScorer {
    private static final double PRECISION = 1_000_000d;

    private final PenaltyWeights weights;

    public ConfidenceScorer(PenaltyWeights weights) {
        this.weights = weights;
    }

    public double score(List<EvidenceItem> items) {
        double score = 1.0;
        for (EvidenceItem item : items) {
            score -= weights.weightOf(item.kind());
        }
        return Math.round(clamp(score) * PRECISION) / PRECISION;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
