package com.di.modelops.audit;

/**
 * Module names written to the audit log.
 */
public final class AuditModule {

    public static final String MONITORING = "mlops_monitoring";
    public static final String RETRAIN_POLICY = "mlops_retrain_policy";
    public static final String RETRAIN_WORKER = "mlops_retrain_worker";

    private AuditModule() {
    }
}
