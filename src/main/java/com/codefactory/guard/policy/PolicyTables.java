package com.codefactory.guard.policy;

import com.codefactory.guard.normalize.LeetspeakTable;
import com.codefactory.guard.rules.RuleTable;
import com.codefactory.guard.semantic.IntentLexicon;
import com.codefactory.guard.whitelist.OperationWhitelist;

public record PolicyTables(
        String version,
        RuleTable rules,
        OperationWhitelist whitelist,
        IntentLexicon lexicon,
        LeetspeakTable leetspeak) {

    public static PolicyTables defaults() {
        return Bundled.TABLES;
    }

    private static final class Bundled {
        private static final PolicyTables TABLES = new PolicyLoader().loadBundled();
    }
}
