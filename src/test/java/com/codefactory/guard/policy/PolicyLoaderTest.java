package com.codefactory.guard.policy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codefactory.guard.rules.Rule;
import com.codefactory.guard.rules.Severity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyLoaderTest {

    @TempDir
    Path tempDir;

    private final PolicyLoader loader = new PolicyLoader();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldLoadBundledPolicy() {
        PolicyTables tables = loader.loadBundled();

        assertEquals("2025.1", tables.version());
        assertEquals(9, tables.whitelist().categories().size());
        assertTrue(tables.rules().find("control-equipment").isPresent());
        assertEquals(Severity.CONFIRM, tables.rules().find("send-email").orElseThrow().severity());
        assertTrue(tables.lexicon().destructiveVerbs().contains("wipe"));
        assertEquals(7, tables.lexicon().riskyPairs().size());
        assertSame(PolicyTables.defaults(), PolicyTables.defaults());
    }

    @Test
    void shouldLoadPolicyFromFile() throws IOException {
        Path policy = tempDir.resolve("policy.yml");
        Files.writeString(policy, """
                version: "test"
                rules:
                  - id: forbidden
                    severity: CRITICAL
                    pattern: '\\bforbidden\\b'
                  - id: ask-first
                    severity: confirm
                    category: review
                    pattern: 'ask'
                    prompt: Ask first?
                approvedOperations:
                  read: [read]
                riskyPairs:
                  - [Hide, Execute]
                """);

        PolicyTables tables = loader.load(policy);

        assertEquals("test", tables.version());
        assertEquals(2, tables.rules().size());
        Rule forbidden = tables.rules().find("forbidden").orElseThrow();
        assertEquals("uncategorized", forbidden.category());
        assertTrue(forbidden.matches("this is FORBIDDEN"));
        assertEquals("Ask first?", tables.rules().find("ask-first").orElseThrow().prompt());
        assertEquals("hide+execute", tables.lexicon().riskyPairs().get(0).label());
    }

    @Test
    void shouldDecodeLeetspeakOnlyIntoPolicyVocabulary() {
        PolicyTables tables = loader.load(yaml("""
                rules:
                  - id: forbidden
                    severity: critical
                    pattern: '\\bforbidden\\b'
                approvedOperations:
                  read: [read]
                destructiveVerbs: [wipe]
                """), "inline");

        assertEquals("forbidden", tables.leetspeak().decode("f0rbidd3n"));
        assertEquals("read", tables.leetspeak().decode("r3ad"));
        assertEquals("wipe", tables.leetspeak().decode("w1pe"));
        assertEquals("h4ck", tables.leetspeak().decode("h4ck"));
        assertEquals("log4j", tables.leetspeak().decode("log4j"));
        assertEquals("hack", PolicyTables.defaults().leetspeak().decode("h4ck"));
    }

    @Test
    void shouldRejectInvalidRegex() {
        PolicyLoadException e = assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules:
                  - id: broken
                    severity: critical
                    pattern: '(unclosed'
                approvedOperations:
                  read: [read]
                """), "inline"));

        assertTrue(e.getMessage().contains("broken"));
    }

    @Test
    void shouldRejectUnknownSeverity() {
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules:
                  - id: odd
                    severity: maybe
                    pattern: 'odd'
                approvedOperations:
                  read: [read]
                """), "inline"));
    }

    @Test
    void shouldRejectMissingFields() {
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules:
                  - severity: critical
                    pattern: 'x'
                approvedOperations:
                  read: [read]
                """), "inline"));
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules:
                  - id: no-pattern
                    severity: critical
                approvedOperations:
                  read: [read]
                """), "inline"));
    }

    @Test
    void shouldRejectDuplicateRuleIds() {
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules:
                  - id: twice
                    severity: critical
                    pattern: 'a'
                  - id: twice
                    severity: confirm
                    pattern: 'b'
                approvedOperations:
                  read: [read]
                """), "inline"));
    }

    @Test
    void shouldRejectPolicyWithoutApprovedOperations() {
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                rules: []
                """), "inline"));
    }

    @Test
    void shouldRejectMalformedRiskyPair() {
        assertThrows(PolicyLoadException.class, () -> loader.load(yaml("""
                approvedOperations:
                  read: [read]
                riskyPairs:
                  - [only-one]
                """), "inline"));
    }

    @Test
    void shouldRejectMissingPolicyFile() {
        assertThrows(PolicyLoadException.class, () -> loader.load(tempDir.resolve("absent.yml")));
    }
}
