package com.di.modelops.sql;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Timestamp conversions shared by the JDBC stores. Dates without a zone are read as UTC.
 */
public final class SqlTimes {

    private SqlTimes() {
    }

    public static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    public static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    /**
     * Converts whatever the driver returned for a DATE / TIMESTAMP column.
     */
    public static Instant fromColumn(Object value) {
        if (value == null) return null;
        if (value instanceof Timestamp) return ((Timestamp) value).toInstant();
        if (value instanceof java.sql.Date) return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof LocalDate) return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof LocalDateTime) return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof java.util.Date) return ((java.util.Date) value).toInstant();
        throw new IllegalArgumentException("Unsupported temporal column type: " + value.getClass().getName());
    }
}
