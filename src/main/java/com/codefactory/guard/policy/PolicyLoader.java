package com.codefactory.guard.policy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.normalize.LeetspeakTable;
import com.codefactory.guard.rules.Rule;
import com.codefactory.guard.rules.RuleTable;
import com.codefactory.guard.rules.Severity;
import com.codefactory.guard.semantic.IntentLexicon;
import com.codefactory.guard.semantic.RiskyPair;
import com.codefactory.guard.whitelist.OperationWhitelist;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class PolicyLoader {
    public static final String BUNDLED_RESOURCE = "/guard-policy.yml";

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);
    private static final Pattern REGEX_ESCAPE = Pattern.compile("\\\\.");
    private static final Pattern PATTERN_KEYWORD = Pattern.compile("[a-z]{4,}");
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public PolicyTables loadBundled() {
        try (InputStream in = PolicyLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new PolicyLoadException("Bundled policy " + BUNDLED_RESOURCE + " is missing from the classpath");
            }
            return load(in, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new PolicyLoadException("Unable to read bundled policy " + BUNDLED_RESOURCE, e);
        }
    }

    public PolicyTables load(Path policyPath) {
        if (!Files.isRegularFile(policyPath)) {
            throw new PolicyLoadException("Policy file not found: " + policyPath.toAbsolutePath().normalize());
        }
        try (InputStream in = Files.newInputStream(policyPath)) {
            return load(in, policyPath.toString());
        } catch (IOException e) {
            throw new PolicyLoadException("Unable to read policy file " + policyPath, e);
        }
    }

    public PolicyTables load(InputStream in, String source) {
        PolicyDocument document;
        try {
            document = mapper.readValue(in, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyLoadException("Malformed policy document " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new PolicyLoadException("Policy document " + source + " is empty");
        }
        PolicyTables tables = compile(document, source);
        log.info("Loaded policy {} version={} rules={} critical={} confirm={} categories={}",
                source,
                tables.version(),
                tables.rules().size(),
                tables.rules().critical().size(),
                tables.rules().confirm().size(),
                tables.whitelist().categories().size());
        return tables;
    }

    PolicyTables compile(PolicyDocument document, String source) {
        List<Rule> rules = new ArrayList<>();
        for (PolicyDocument.RuleDefinition definition : document.getRules()) {
            rules.add(compileRule(definition, source));
        }
        if (document.getApprovedOperations().isEmpty()) {
            throw new PolicyLoadException("Policy " + source + " defines no approved operations");
        }

        List<RiskyPair> pairs = new ArrayList<>();
        for (List<String> pair : document.getRiskyPairs()) {
            if (pair == null || pair.size() != 2 || isBlank(pair.get(0)) || isBlank(pair.get(1))) {
                throw new PolicyLoadException("Risky pair in " + source + " must list exactly two words: " + pair);
            }
            pairs.add(new RiskyPair(pair.get(0).toLowerCase(Locale.ROOT), pair.get(1).toLowerCase(Locale.ROOT)));
        }

        RuleTable table;
        try {
            table = new RuleTable(rules);
        } catch (IllegalArgumentException e) {
            throw new PolicyLoadException("Invalid rule table in " + source + ": " + e.getMessage(), e);
        }
        IntentLexicon lexicon = new IntentLexicon(document.getDestructiveVerbs(), pairs, document.getPrivilegedContexts());
        OperationWhitelist whitelist = new OperationWhitelist(document.getApprovedOperations());
        return new PolicyTables(
                document.getVersion(),
                table,
                whitelist,
                lexicon,
                LeetspeakTable.forVocabulary(vocabulary(rules, whitelist, lexicon)));
    }

    // literal keywords of every rule pattern plus lexicon and whitelist words
    static Set<String> vocabulary(List<Rule> rules, OperationWhitelist whitelist, IntentLexicon lexicon) {
        Set<String> words = new LinkedHashSet<>();
        for (Rule rule : rules) {
            Matcher matcher = PATTERN_KEYWORD.matcher(REGEX_ESCAPE.matcher(rule.pattern().pattern()).replaceAll(" "));
            while (matcher.find()) {
                words.add(matcher.group().toLowerCase(Locale.ROOT));
            }
        }
        whitelist.categories().values().forEach(words::addAll);
        words.addAll(lexicon.destructiveVerbs());
        words.addAll(lexicon.privilegedContexts());
        for (RiskyPair pair : lexicon.riskyPairs()) {
            words.add(pair.first());
            words.add(pair.second());
        }
        return words;
    }

    private static Rule compileRule(PolicyDocument.RuleDefinition definition, String source) {
        if (isBlank(definition.getId())) {
            throw new PolicyLoadException("Rule without id in " + source);
        }
        if (isBlank(definition.getPattern())) {
            throw new PolicyLoadException("Rule " + definition.getId() + " in " + source + " has no pattern");
        }
        Severity severity = parseSeverity(definition, source);
        Pattern pattern;
        try {
            pattern = Pattern.compile(definition.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new PolicyLoadException("Rule " + definition.getId() + " in " + source + " has an invalid pattern: "
                    + e.getDescription(), e);
        }
        return new Rule(
                definition.getId(),
                definition.getVersion(),
                severity,
                definition.getCategory(),
                pattern,
                definition.getDescription(),
                definition.getPrompt());
    }

    private static Severity parseSeverity(PolicyDocument.RuleDefinition definition, String source) {
        if (isBlank(definition.getSeverity())) {
            throw new PolicyLoadException("Rule " + definition.getId() + " in " + source + " has no severity");
        }
        try {
            return Severity.valueOf(definition.getSeverity().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PolicyLoadException("Rule " + definition.getId() + " in " + source
                    + " has unknown severity '" + definition.getSeverity() + "' (expected critical or confirm)", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
