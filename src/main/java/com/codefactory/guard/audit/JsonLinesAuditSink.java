package com.codefactory.guard.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.codefactory.guard.model.AuditRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Writes one JSON document per line. Appends are serialized per instance so that concurrent evaluations never
 * interleave within a line.
 */
public class JsonLinesAuditSink implements AuditSink {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path auditLogPath;
    private final Object writeLock = new Object();

    public JsonLinesAuditSink(Path auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    @Override
    public void append(AuditRecord record) throws IOException {
        byte[] line = (mapper.writeValueAsString(record) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        synchronized (writeLock) {
            if (auditLogPath.getParent() != null) {
                Files.createDirectories(auditLogPath.getParent());
            }
            Files.write(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
    }

    public List<AuditRecord> readAll() throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<String> lines = Files.readAllLines(auditLogPath, StandardCharsets.UTF_8);
        List<AuditRecord> records = new ArrayList<>();
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            records.add(mapper.readValue(line, AuditRecord.class));
        }
        return records;
    }

    public Path path() {
        return auditLogPath;
    }

    @Override
    public String name() {
        return "jsonl:" + auditLogPath;
    }
}
