package com.di.modelops.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One row of the shared audit log: which module ran, how it ended, and a small detail map.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRecord {

    public static final String SUCCESS = "success";
    public static final String DEGRADED = "degraded";
    public static final String FAILED = "failed";

    Long id;
    Instant runTime;
    String module;
    String status;
    int recordsProcessed;
    String errors;
    @Singular
    Map<String, Object> details;
}
