package com.di.modelops.error;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.jdbc.BadSqlGrammarException;

import java.io.IOException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Schema-not-provisioned detection
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "42P01, relation \"retrain_jobs\" does not exist",
            "42703, column \"active_cohort\" does not exist",
            "42S02, Table \"RETRAIN_JOBS\" not found",
            "42S03, Table \"RETRAIN_JOBS\" not found (candidates are: ...)",
            "42S04, Table \"RETRAIN_JOBS\" not found (this database is empty)",
            "42S22, Column \"ACTIVE_COHORT\" not found"
    })
    @DisplayName("Should classify missing table/column SQL states as SCHEMA_NOT_PROVISIONED")
    void testCategorize_MissingObjectStates(String sqlState, String message) {
        SQLException sqlEx = new SQLException(message, sqlState);
        assertEquals(ErrorCategory.SCHEMA_NOT_PROVISIONED, ErrorCategory.categorize(sqlEx));
        assertTrue(ErrorCategory.isSchemaNotProvisioned(sqlEx));
    }

    @Test
    @DisplayName("Should find the SQL state through Spring's DataAccessException wrapper")
    void testCategorize_WrappedMissingTable() {
        SQLException sqlEx = new SQLException("relation \"mlops_audit\" does not exist", "42P01");
        BadSqlGrammarException wrapped = new BadSqlGrammarException("audit.insert", "INSERT INTO mlops_audit ...", sqlEx);
        assertTrue(ErrorCategory.isSchemaNotProvisioned(wrapped));
    }

    @Test
    @DisplayName("Should not treat a message mentioning a missing table as schema-missing without the SQL state")
    void testCategorize_MessageOnlyIsNotSchemaMissing() {
        RuntimeException ex = new RuntimeException("relation \"retrain_jobs\" does not exist");
        assertFalse(ErrorCategory.isSchemaNotProvisioned(ex));
    }

    // ============================================================================
    // SQL Exception Categorization Tests
    // ============================================================================

    @Test
    @DisplayName("Should categorize SQL connection errors by SQL state")
    void testCategorize_SqlConnectionError() {
        SQLException sqlEx = new SQLException("Connection failed", "08001");
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(sqlEx));
    }

    @Test
    @DisplayName("Should categorize SQL constraint violations by SQL state")
    void testCategorize_SqlConstraintViolation() {
        SQLException sqlEx = new SQLException("duplicate key value violates unique constraint", "23505");
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, ErrorCategory.categorize(sqlEx));
    }

    @Test
    @DisplayName("Should categorize other 42xxx states as SQL syntax errors")
    void testCategorize_SqlSyntaxError() {
        SQLException sqlEx = new SQLException("Syntax error", "42601");
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, ErrorCategory.categorize(sqlEx));
    }

    @Test
    @DisplayName("Should categorize SQL transaction rollback by SQL state")
    void testCategorize_SqlTransactionRollback() {
        SQLException sqlEx = new SQLException("could not serialize access", "40001");
        assertEquals(ErrorCategory.TRANSACTION_ROLLBACK, ErrorCategory.categorize(sqlEx));
    }

    @Test
    @DisplayName("Should categorize SQL errors by message when SQL state unavailable")
    void testCategorize_SqlErrorByMessage() {
        SQLException sqlEx = new SQLException("Connection refused");
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(sqlEx));
    }

    @Test
    @DisplayName("Should fall back to DATABASE_ERROR for unrecognised SQL errors")
    void testCategorize_GenericSqlError() {
        SQLException sqlEx = new SQLException("disk full", "53100");
        assertEquals(ErrorCategory.DATABASE_ERROR, ErrorCategory.categorize(sqlEx));
    }

    // ============================================================================
    // Non-SQL categories
    // ============================================================================

    @Test
    @DisplayName("Should categorize TimeoutException as timeout error")
    void testCategorize_TimeoutException() {
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new TimeoutException("Operation timed out")));
    }

    @Test
    @DisplayName("Should categorize Jackson failures as serialization errors")
    void testCategorize_JsonError() {
        JsonParseException ex = new JsonParseException(null, "Unexpected character");
        assertEquals(ErrorCategory.SERIALIZATION_ERROR, ErrorCategory.categorize(ex));
    }

    @Test
    @DisplayName("Should categorize IllegalStateException as validation error")
    void testCategorize_IllegalStateException() {
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalStateException("Invalid state")));
    }

    @Test
    @DisplayName("Should categorize IOException as resource error")
    void testCategorize_IOException() {
        assertEquals(ErrorCategory.RESOURCE_ERROR, ErrorCategory.categorize(new IOException("No such file")));
    }

    @Test
    @DisplayName("Should return UNKNOWN for null exception")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Should return APPLICATION_ERROR for unclassified exceptions")
    void testCategorize_UnclassifiedException() {
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("Generic error")));
    }

    @Test
    @DisplayName("Should return correct string representation")
    void testToString() {
        assertEquals("SCHEMA_NOT_PROVISIONED", ErrorCategory.SCHEMA_NOT_PROVISIONED.toString());
    }

    @ParameterizedTest
    @MethodSource("provideErrorCategories")
    @DisplayName("Should have non-empty name and description for all categories")
    void testAllCategoriesHaveNameAndDescription(ErrorCategory category) {
        assertNotNull(category.getName());
        assertNotNull(category.getDescription());
        assertFalse(category.getName().isEmpty());
        assertFalse(category.getDescription().isEmpty());
    }

    static Stream<Arguments> provideErrorCategories() {
        return Stream.of(ErrorCategory.values())
                .map(Arguments::of);
    }
}
