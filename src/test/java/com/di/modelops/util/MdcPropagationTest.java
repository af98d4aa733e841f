package com.di.modelops.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Entries are visible inside the task and removed after")
    void testCallWithContext_ScopesEntries() {
        String seen = MdcPropagation.callWithContext(Map.of("jobId", "42", "cohort", "2025-26"),
                () -> MDC.get("jobId") + "/" + MDC.get("cohort"));

        assertEquals("42/2025-26", seen);
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("cohort"));
    }

    @Test
    @DisplayName("The caller's MDC is restored, even when the task throws")
    void testCallWithContext_RestoresOnFailure() {
        MDC.put("jobId", "outer");

        assertThrows(IllegalStateException.class, () -> MdcPropagation.callWithContext(Map.of("jobId", "7"), () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("outer", MDC.get("jobId"));
    }

    @Test
    @DisplayName("Null values are skipped")
    void testCallWithContext_NullValues() {
        Map<String, String> entries = new HashMap<>();
        entries.put("jobId", "1");
        entries.put("cohort", null);

        Boolean hasCohort = MdcPropagation.callWithContext(entries, () -> MDC.get("cohort") != null);

        assertFalse(hasCohort);
    }
}
