package com.codefactory.guard.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.codefactory.guard.model.AuditRecord;

public class InMemoryAuditSink implements AuditSink {
    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditRecord record) {
        records.add(record);
    }

    public List<AuditRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public String name() {
        return "memory";
    }
}
