package com.di.modelops.audit;

import java.util.List;

/**
 * Records one audit event per monitoring evaluation, policy evaluation and worker tick.
 * When persistence is disabled, a no-op implementation is used.
 */
public interface AuditSink {

    /**
     * Records one event. Never fails the operation being audited.
     */
    void record(AuditRecord record);

    /**
     * Returns recent audit rows for a module, newest first. Empty when persistence is disabled.
     */
    List<AuditRecord> findRecent(String module, int limit);
}
