package com.di.modelops.sql;

import com.di.modelops.support.SqlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaGuard Tests")
class SchemaGuardTest {

    private JdbcTemplate jdbc;
    private SchemaGuard guard;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(SqlFixtures.newDatabase());
        guard = new SchemaGuard(new SchemaProvisioner(jdbc, SqlFixtures.queries()));
    }

    @Test
    @DisplayName("Missing table: provisions the schema and retries exactly once")
    void testCall_ProvisionsAndRetries() {
        AtomicInteger attempts = new AtomicInteger();

        long count = guard.call("jobs.count", () -> {
            attempts.incrementAndGet();
            return SqlFixtures.count(jdbc, "retrain_jobs");
        });

        assertEquals(0L, count);
        assertEquals(2, attempts.get());
        assertEquals(0L, SqlFixtures.count(jdbc, "mlops_audit"));
        assertEquals(0L, SqlFixtures.count(jdbc, "mlops_monitoring_snapshot"));
    }

    @Test
    @DisplayName("Other failures propagate without provisioning or retry")
    void testCall_OtherFailurePropagates() {
        AtomicInteger attempts = new AtomicInteger();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> guard.call("op", () -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        }));

        assertEquals("bad input", e.getMessage());
        assertEquals(1, attempts.get());
        assertThrows(RuntimeException.class, () -> SqlFixtures.count(jdbc, "retrain_jobs"));
    }

    @Test
    @DisplayName("Provisioning is idempotent")
    void testProvision_Idempotent() {
        SchemaProvisioner provisioner = new SchemaProvisioner(jdbc, SqlFixtures.queries());

        provisioner.provision();
        jdbc.update("INSERT INTO mlops_audit (module, status) VALUES ('m', 'success')");
        provisioner.provision();

        assertEquals(1L, SqlFixtures.count(jdbc, "mlops_audit"));
    }

    @Test
    @DisplayName("run() retries a void operation the same way")
    void testRun_Retries() {
        guard.run("audit.insert", () -> jdbc.update("INSERT INTO mlops_audit (module, status) VALUES ('m', 'failed')"));

        assertEquals(1L, SqlFixtures.count(jdbc, "mlops_audit"));
    }
}
