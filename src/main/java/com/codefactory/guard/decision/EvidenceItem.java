package com.codefactory.guard.decision;

public record EvidenceItem(EvidenceKind kind, String detail) {
}
