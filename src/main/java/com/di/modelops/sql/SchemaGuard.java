package com.di.modelops.sql;

import com.di.modelops.error.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a store operation; when it fails because the schema is not provisioned yet, provisions the
 * schema and retries the operation exactly once. Every other failure propagates unmodified.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class SchemaGuard {

    private final SchemaProvisioner provisioner;

    public SchemaGuard(SchemaProvisioner provisioner) {
        this.provisioner = provisioner;
    }

    public <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            if (!ErrorCategory.isSchemaNotProvisioned(e)) {
                throw e;
            }
            log.warn("[SCHEMA] {} hit missing schema ({}); provisioning and retrying once", operation, e.getMessage());
            provisioner.provision();
            return action.get();
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
