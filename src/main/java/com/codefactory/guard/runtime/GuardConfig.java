package com.codefactory.guard.runtime;

import com.codefactory.guard.decision.PenaltyWeights;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GuardConfig {
    private double confidenceThreshold = 0.5;
    private boolean leetspeakEnabled = true;
    private String policyPath;
    private PenaltyConfig penalties = new PenaltyConfig();
    private AuditConfig audit = new AuditConfig();

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean isLeetspeakEnabled() {
        return leetspeakEnabled;
    }

    public void setLeetspeakEnabled(boolean leetspeakEnabled) {
        this.leetspeakEnabled = leetspeakEnabled;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public void setPolicyPath(String policyPath) {
        this.policyPath = policyPath;
    }

    public PenaltyConfig getPenalties() {
        return penalties;
    }

    public void setPenalties(PenaltyConfig penalties) {
        this.penalties = penalties == null ? new PenaltyConfig() : penalties;
    }

    public AuditConfig getAudit() {
        return audit;
    }

    public void setAudit(AuditConfig audit) {
        this.audit = audit == null ? new AuditConfig() : audit;
    }

    public void validate() {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0.0, 1.0] (was " + confidenceThreshold + ")");
        }
        penalties.toWeights();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PenaltyConfig {
        private double bypassAttempt = 0.2;
        private double semanticFlag = 0.1;
        private double whitelistViolation = 0.05;
        private double emptyRequest = 1.0;

        public double getBypassAttempt() {
            return bypassAttempt;
        }

        public void setBypassAttempt(double bypassAttempt) {
            this.bypassAttempt = bypassAttempt;
        }

        public double getSemanticFlag() {
            return semanticFlag;
        }

        public void setSemanticFlag(double semanticFlag) {
            this.semanticFlag = semanticFlag;
        }

        public double getWhitelistViolation() {
            return whitelistViolation;
        }

        public void setWhitelistViolation(double whitelistViolation) {
            this.whitelistViolation = whitelistViolation;
        }

        public double getEmptyRequest() {
            return emptyRequest;
        }

        public void setEmptyRequest(double emptyRequest) {
            this.emptyRequest = emptyRequest;
        }

        public PenaltyWeights toWeights() {
            return new PenaltyWeights(bypassAttempt, semanticFlag, whitelistViolation, emptyRequest);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuditConfig {
        private boolean enabled = true;
        private String sink = "jsonl";
        private String path = ".guard/audit-log.jsonl";
        private String webhookUrl;
        private String webhookApiKey;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSink() {
            return sink;
        }

        public void setSink(String sink) {
            this.sink = sink;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getWebhookApiKey() {
            return webhookApiKey;
        }

        public void setWebhookApiKey(String webhookApiKey) {
            this.webhookApiKey = webhookApiKey;
        }
    }
}
