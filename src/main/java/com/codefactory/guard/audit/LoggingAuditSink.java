package com.codefactory.guard.audit;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codefactory.guard.model.AuditRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class LoggingAuditSink implements AuditSink {
    public static final String LOGGER_NAME = "request-guard.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    @Override
    public void append(AuditRecord record) throws IOException {
        audit.info("AUDIT: timestamp={}, requestId={}, decision={}, approved={}, confidence={}, patterns={} record={}",
                record.timestamp(),
                record.requestId(),
                record.decision(),
                record.approved(),
                record.confidenceScore(),
                record.patternsMatched().size(),
                mapper.writeValueAsString(record));
    }

    @Override
    public String name() {
        return "log:" + LOGGER_NAME;
    }
}
