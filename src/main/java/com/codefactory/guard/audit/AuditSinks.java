package com.codefactory.guard.audit;

import java.nio.file.Path;
import java.util.Locale;

import com.codefactory.guard.model.AuditRecord;
import com.codefactory.guard.runtime.GuardConfig;

import okhttp3.OkHttpClient;

public final class AuditSinks {
    private AuditSinks() {
    }

    public static AuditSink discarding() {
        return new AuditSink() {
            @Override
            public void append(AuditRecord record) {
                // auditing disabled
            }

            @Override
            public String name() {
                return "none";
            }
        };
    }

    public static AuditSink fromConfig(GuardConfig.AuditConfig config, OkHttpClient httpClient) {
        if (!config.isEnabled()) {
            return discarding();
        }
        String sink = config.getSink() == null ? "jsonl" : config.getSink().toLowerCase(Locale.ROOT);
        return switch (sink) {
            case "jsonl", "file" -> new JsonLinesAuditSink(Path.of(config.getPath()));
            case "log" -> new LoggingAuditSink();
            case "webhook" -> {
                if (config.getWebhookUrl() == null || config.getWebhookUrl().isBlank()) {
                    throw new IllegalArgumentException("audit.webhookUrl is required when audit.sink is webhook");
                }
                yield new WebhookAuditSink(httpClient, config.getWebhookUrl(), config.getWebhookApiKey());
            }
            case "none" -> discarding();
            default -> throw new IllegalArgumentException("Unknown audit sink '" + config.getSink()
                    + "' (expected jsonl, log, webhook or none)");
        };
    }
}
