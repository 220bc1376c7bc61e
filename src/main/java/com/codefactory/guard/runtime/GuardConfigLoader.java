package com.codefactory.guard.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class GuardConfigLoader {
    public static final String ENV_CONFIDENCE_THRESHOLD = "GUARD_CONFIDENCE_THRESHOLD";
    public static final String ENV_LEETSPEAK_ENABLED = "GUARD_LEETSPEAK_ENABLED";
    public static final String ENV_AUDIT_SINK = "GUARD_AUDIT_SINK";
    public static final String ENV_AUDIT_PATH = "GUARD_AUDIT_PATH";
    public static final String ENV_AUDIT_WEBHOOK_URL = "GUARD_AUDIT_WEBHOOK_URL";
    public static final String ENV_AUDIT_WEBHOOK_API_KEY = "GUARD_AUDIT_WEBHOOK_API_KEY";

    private static final Logger log = LoggerFactory.getLogger(GuardConfigLoader.class);
    private final Map<String, String> environment;

    public GuardConfigLoader() {
        this(System.getenv());
    }

    public GuardConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public GuardConfig load(Path configPath) throws IOException {
        GuardConfig config;
        if (configPath == null || !Files.exists(configPath)) {
            config = new GuardConfig();
        } else {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(configPath.toFile(), GuardConfig.class);
            if (config == null) {
                config = new GuardConfig();
            }
            log.info("Using config file: {}", configPath);
        }
        applyEnvironment(config);
        config.validate();
        return config;
    }

    void applyEnvironment(GuardConfig config) {
        String threshold = environment.get(ENV_CONFIDENCE_THRESHOLD);
        if (threshold != null && !threshold.isBlank()) {
            try {
                config.setConfidenceThreshold(Double.parseDouble(threshold.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_CONFIDENCE_THRESHOLD + " is not a number: " + threshold, e);
            }
        }
        String leetspeak = environment.get(ENV_LEETSPEAK_ENABLED);
        if (leetspeak != null && !leetspeak.isBlank()) {
            config.setLeetspeakEnabled(parseBoolean(ENV_LEETSPEAK_ENABLED, leetspeak));
        }
        String sink = environment.get(ENV_AUDIT_SINK);
        if (sink != null && !sink.isBlank()) {
            config.getAudit().setSink(sink.trim());
        }
        String path = environment.get(ENV_AUDIT_PATH);
        if (path != null && !path.isBlank()) {
            config.getAudit().setPath(path.trim());
        }
        String webhookUrl = environment.get(ENV_AUDIT_WEBHOOK_URL);
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            config.getAudit().setWebhookUrl(webhookUrl.trim());
        }
        String apiKey = environment.get(ENV_AUDIT_WEBHOOK_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            config.getAudit().setWebhookApiKey(apiKey.trim());
        }
    }

    private static boolean parseBoolean(String name, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true/false, 1/0 or yes/no (was " + value + ")");
    }
}
