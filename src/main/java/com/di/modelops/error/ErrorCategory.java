package com.di.modelops.error;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Standardized error categories for store retries, audit records and worker logs.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Storage errors are classified by SQLState found anywhere on the cause chain, so Spring's
 * {@code DataAccessException} wrappers classify the same as the raw driver exception.
 * To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SCHEMA_NOT_PROVISIONED("Schema not provisioned", "Table or column required by the store does not exist yet"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Payload serialization or deserialization failure"),
    RESOURCE_ERROR("Resource error", "File system or process resource unavailable"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    /**
     * Undefined table / column. PostgreSQL: 42P01, 42703. H2: 42S02 (table), 42S03 / 42S04 (table, with
     * candidates / empty database), 42S22 (column).
     */
    private static final Set<String> MISSING_OBJECT_STATES = Set.of("42P01", "42703", "42S02", "42S03", "42S04", "42S22");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Add new categories before APPLICATION_ERROR. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * True when the failure means the store's tables/columns are not provisioned yet.
     */
    public static boolean isSchemaNotProvisioned(Throwable exception) {
        return categorize(exception) == SCHEMA_NOT_PROVISIONED;
    }

    private static SQLException findSqlException(Throwable exception) {
        Throwable current = exception;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            if (MISSING_OBJECT_STATES.contains(sqlState)) {
                return SCHEMA_NOT_PROVISIONED;
            }
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof java.io.IOException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
