package com.codefactory.guard.whitelist;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.codefactory.guard.normalize.Tokens;
import com.codefactory.guard.policy.PolicyTables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhitelistValidatorTest {
    private final WhitelistValidator validator = new WhitelistValidator(PolicyTables.defaults().whitelist());

    @Test
    void shouldCollectMatchedCategoriesForApprovedRequest() {
        WhitelistResult result = validator.validate("parse alarm logs and display summaries on a dashboard");

        assertEquals("parse", result.headVerb());
        assertTrue(result.violations().isEmpty());
        assertTrue(result.matchedCategories().containsAll(List.of("calculate", "monitor", "read")));
    }

    @Test
    void shouldReportUnapprovedHeadOperation() {
        WhitelistResult result = validator.validate("send alert emails when critical alarms are detected");

        assertEquals(List.of("Unapproved operation: send"), result.violations());
    }

    @Test
    void shouldSkipFillerAndFramingNouns() {
        assertEquals("build", WhitelistValidator.headVerb(Tokens.words("please build a report")));
        assertEquals("scan", WhitelistValidator.headVerb(Tokens.words("i want to scan the inventory")));
        assertEquals("sends", WhitelistValidator.headVerb(Tokens.words("a tool that sends emails")));
        assertEquals("track", WhitelistValidator.headVerb(Tokens.words("an app to track deliveries")));
        assertNull(WhitelistValidator.headVerb(Tokens.words("a dashboard")));
    }

    @Test
    void shouldNotReportViolationForEmptyText() {
        WhitelistResult result = validator.validate("");

        assertNull(result.headVerb());
        assertTrue(result.violations().isEmpty());
        assertTrue(result.matchedCategories().isEmpty());
    }

    @Test
    void shouldMatchStemsAcrossCategories() {
        OperationWhitelist whitelist = new OperationWhitelist(Map.of(
                "transform", List.of("encode", "convert"),
                "read", List.of("read")));

        assertEquals(List.of("transform"), List.copyOf(whitelist.categoriesOf("encoding")));
        assertTrue(whitelist.isApproved("reads"));
        assertFalse(whitelist.isApproved("delete"));
    }
}
