package com.codefactory.guard.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codefactory.guard.model.AuditRecord;
import com.codefactory.guard.model.Decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLinesAuditSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendOneLinePerRecordAndReadThemBack() throws IOException {
        Path log = tempDir.resolve("nested/audit-log.jsonl");
        JsonLinesAuditSink sink = new JsonLinesAuditSink(log);

        sink.append(AuditRecords.blocked("req-1"));
        sink.append(AuditRecords.blocked("req-2"));

        assertEquals(2, Files.readAllLines(log, StandardCharsets.UTF_8).size());
        List<AuditRecord> records = sink.readAll();
        assertEquals(List.of("req-1", "req-2"), records.stream().map(AuditRecord::requestId).toList());
        AuditRecord first = records.get(0);
        assertEquals(Decision.BLOCKED, first.decision());
        assertEquals(AuditRecords.blocked("req-1").timestamp(), first.timestamp());
        assertEquals(List.of("hack"), first.patternsMatched());
        assertTrue(first.bypassAttemptsDetected().contains("case-mixing"));
    }

    @Test
    void shouldReturnNoRecordsWhenLogIsMissing() throws IOException {
        assertTrue(new JsonLinesAuditSink(tempDir.resolve("absent.jsonl")).readAll().isEmpty());
    }

    @Test
    void shouldNotInterleaveConcurrentAppends() throws Exception {
        JsonLinesAuditSink sink = new JsonLinesAuditSink(tempDir.resolve("audit-log.jsonl"));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        sink.append(AuditRecords.blocked("req-" + thread + "-" + i));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<AuditRecord> records = sink.readAll();
        assertEquals(200, records.size());
        assertEquals(200, records.stream().map(AuditRecord::requestId).distinct().count());
    }
}
