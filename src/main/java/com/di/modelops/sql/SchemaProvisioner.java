package com.di.modelops.sql;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the snapshot, retrain-job and audit tables if absent, adds columns introduced after the
 * first table version and backfills pre-existing rows. Every statement is idempotent, so this is
 * safe to run at startup and again whenever a store hits a missing table.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class SchemaProvisioner {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public SchemaProvisioner(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    public synchronized void provision() {
        List<String> statements = sql.getSchema().getStatements();
        if (statements == null || statements.isEmpty()) {
            throw new IllegalStateException("No schema statements configured (modelops.sql.schema.statements)");
        }
        for (String statement : statements) {
            jdbc.execute(statement);
        }
        log.info("[SCHEMA] Provisioned monitoring/retrain/audit schema ({} statements)", statements.size());
    }
}
