package com.codefactory.guard.audit;

import java.io.IOException;

import com.codefactory.guard.model.AuditRecord;

public interface AuditSink {

    void append(AuditRecord record) throws IOException;

    String name();
}
