package com.di.modelops.config;

import com.di.modelops.sql.SchemaProvisioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * At startup, provisions the monitoring/retrain/audit schema once so the first request does not pay
 * for it. Stores still provision lazily on a missing table, so a failure here is logged, not fatal.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class SchemaStartupInitializer implements ApplicationRunner {

    private final SchemaProvisioner schemaProvisioner;
    private final ModelOpsProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSchema().isProvisionOnStartup()) {
            log.info("[SCHEMA] provision-on-startup: false; tables will be created on first use.");
            return;
        }
        try {
            schemaProvisioner.provision();
        } catch (RuntimeException e) {
            log.error("[SCHEMA] Startup provisioning failed; stores will retry on first use: {}", e.getMessage());
        }
    }
}
