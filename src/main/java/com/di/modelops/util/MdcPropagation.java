package com.di.modelops.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scopes SLF4J MDC entries (e.g. {@code jobId}, {@code cohort}) to one unit of work so that every log
 * line written while a retrain job is processed carries its id, and the caller's MDC is restored after.
 * <p>
 * Usage: {@code MdcPropagation.callWithContext(Map.of("jobId", "42"), () -> process(job));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Puts {@code entries} into the MDC, runs {@code task}, then restores the previous MDC of this thread.
     * Null values are skipped.
     */
    public static <T> T callWithContext(Map<String, String> entries, Supplier<T> task) {
        Map<String, String> previous = copyMdc();
        try {
            if (entries != null) {
                entries.forEach((key, value) -> {
                    if (key != null && value != null) {
                        MDC.put(key, value);
                    }
                });
            }
            return task.get();
        } finally {
            restoreMdc(previous);
        }
    }

    private static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map != null ? new HashMap<>(map) : Collections.emptyMap();
    }

    private static void restoreMdc(Map<String, String> previous) {
        if (previous.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
