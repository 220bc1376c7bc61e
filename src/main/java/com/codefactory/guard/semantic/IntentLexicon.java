package com.codefactory.guard.semantic;

import java.util.List;

public record IntentLexicon(List<String> destructiveVerbs, List<RiskyPair> riskyPairs, List<String> privilegedContexts) {

    public IntentLexicon {
        destructiveVerbs = List.copyOf(destructiveVerbs);
        riskyPairs = List.copyOf(riskyPairs);
        privilegedContexts = List.copyOf(privilegedContexts);
    }
}
