package com.codefactory.guard.decision;

public enum EvidenceKind {
    BYPASS_ATTEMPT,
    SEMANTIC_FLAG,
    WHITELIST_VIOLATION,
    EMPTY_REQUEST
}
