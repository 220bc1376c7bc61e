package com.codefactory.guard;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.audit.JsonLinesAuditSink;
import com.codefactory.guard.model.AuditRecord;
import com.codefactory.guard.model.Decision;
import com.codefactory.guard.model.Request;
import com.codefactory.guard.model.SafetyCheck;
import com.codefactory.guard.policy.PolicyLoadException;
import com.codefactory.guard.runtime.GuardConfig;
import com.codefactory.guard.runtime.GuardConfigLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "request-guard",
        mixinStandardHelpOptions = true,
        version = "request-guard 0.1.0",
        description = "Evaluates project requests against the content-safety policy.")
public class Main implements Callable<Integer> {
    static final int EXIT_APPROVED = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_CONFIRMATION_REQUIRED = 3;
    static final int EXIT_BLOCKED = 4;
    static final int EXIT_CONFIG_ERROR = 5;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "guard.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "evaluate")
    Mode mode;

    @Option(names = { "-d", "--description" }, description = "Free-text request description")
    String description;

    @Option(names = "--feature", description = "Declared feature (repeatable)")
    List<String> features = new ArrayList<>();

    @Option(names = "--constraint", description = "Declared constraint (repeatable)")
    List<String> constraints = new ArrayList<>();

    @Option(names = "--target-user", description = "Target user role (repeatable)")
    List<String> targetUsers = new ArrayList<>();

    @Option(names = "--environment", description = "Operating environment")
    String environment;

    @Option(names = "--request-file", description = "JSON file holding the request")
    Path requestFile;

    @Option(names = "--audit-log", description = "JSON Lines audit log; overrides audit.path from the config")
    Path auditLogPath;

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        evaluate,
        summary
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        GuardConfig config;
        try {
            config = new GuardConfigLoader().load(configPath);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        if (auditLogPath != null) {
            config.getAudit().setSink("jsonl");
            config.getAudit().setPath(auditLogPath.toString());
        }

        if (mode == Mode.summary) {
            return summarizeAuditLog(Path.of(config.getAudit().getPath()));
        }

        Request request;
        try {
            request = readRequest();
        } catch (IOException | RuntimeException e) {
            log.error("Invalid request: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        SafetyGuard guard;
        try {
            guard = createGuard(config);
        } catch (PolicyLoadException | IllegalArgumentException e) {
            log.error("Unable to initialise guard: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        SafetyCheck result = guard.evaluate(request);
        out().println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        out().flush();
        return switch (result.decision()) {
            case APPROVED -> EXIT_APPROVED;
            case CONFIRM_REQUIRED -> EXIT_CONFIRMATION_REQUIRED;
            default -> EXIT_BLOCKED;
        };
    }

    SafetyGuard createGuard(GuardConfig config) {
        return SafetyGuard.fromConfig(config, httpClient);
    }

    Request readRequest() throws IOException {
        if (requestFile != null) {
            if (!Files.isRegularFile(requestFile)) {
                throw new IllegalArgumentException("--request-file does not exist: " + requestFile.toAbsolutePath().normalize());
            }
            return mapper.readValue(requestFile.toFile(), Request.class);
        }
        if (description == null) {
            throw new IllegalArgumentException("--description or --request-file is required in evaluate mode");
        }
        return new Request(description, targetUsers, environment, features, constraints);
    }

    private int summarizeAuditLog(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.error("Audit log not found: {}", path.toAbsolutePath().normalize());
            return EXIT_USAGE_ERROR;
        }
        List<AuditRecord> records;
        try {
            records = new JsonLinesAuditSink(path).readAll();
        } catch (IOException e) {
            log.error("Unreadable audit log {}: {}", path, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        Map<Decision, Integer> counts = new EnumMap<>(Decision.class);
        double confidenceSum = 0.0;
        int skipped = 0;
        for (AuditRecord record : records) {
            if (record.decision() == null) {
                skipped++;
                continue;
            }
            counts.merge(record.decision(), 1, Integer::sum);
            confidenceSum += record.confidenceScore();
        }
        if (skipped > 0) {
            log.warn("Skipped {} audit records without a decision in {}", skipped, path);
        }
        int counted = records.size() - skipped;
        PrintWriter out = out();
        out.printf("records=%d%n", counted);
        out.printf("skipped=%d%n", skipped);
        for (Decision decision : Decision.values()) {
            if (decision.isTerminal()) {
                out.printf("%s=%d%n", decision, counts.getOrDefault(decision, 0));
            }
        }
        out.printf(Locale.ROOT, "meanConfidence=%.4f%n", counted == 0 ? 0.0 : confidenceSum / counted);
        out.flush();
        return EXIT_APPROVED;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }
}
