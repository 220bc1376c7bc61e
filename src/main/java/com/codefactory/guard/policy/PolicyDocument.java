package com.codefactory.guard.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyDocument {
    private String version = "1";
    private List<RuleDefinition> rules = new ArrayList<>();
    private Map<String, List<String>> approvedOperations = new LinkedHashMap<>();
    private List<String> destructiveVerbs = new ArrayList<>();
    private List<List<String>> riskyPairs = new ArrayList<>();
    private List<String> privilegedContexts = new ArrayList<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules == null ? new ArrayList<>() : rules;
    }

    public Map<String, List<String>> getApprovedOperations() {
        return approvedOperations;
    }

    public void setApprovedOperations(Map<String, List<String>> approvedOperations) {
        this.approvedOperations = approvedOperations == null ? new LinkedHashMap<>() : approvedOperations;
    }

    public List<String> getDestructiveVerbs() {
        return destructiveVerbs;
    }

    public void setDestructiveVerbs(List<String> destructiveVerbs) {
        this.destructiveVerbs = destructiveVerbs == null ? new ArrayList<>() : destructiveVerbs;
    }

    public List<List<String>> getRiskyPairs() {
        return riskyPairs;
    }

    public void setRiskyPairs(List<List<String>> riskyPairs) {
        this.riskyPairs = riskyPairs == null ? new ArrayList<>() : riskyPairs;
    }

    public List<String> getPrivilegedContexts() {
        return privilegedContexts;
    }

    public void setPrivilegedContexts(List<String> privilegedContexts) {
        this.privilegedContexts = privilegedContexts == null ? new ArrayList<>() : privilegedContexts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleDefinition {
        private String id;
        private int version = 1;
        private String severity;
        private String category;
        private String pattern;
        private String description;
        private String prompt;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getVersion() {
            return version;
        }

        public void setVersion(int version) {
            this.version = version;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }
    }
}
