package com.di.modelops.audit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

@Service
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "false")
public class NoOpAuditSink implements AuditSink {

    @Override
    public void record(AuditRecord record) {
        // no-op when persistence is disabled
    }

    @Override
    public List<AuditRecord> findRecent(String module, int limit) {
        return Collections.emptyList();
    }
}
