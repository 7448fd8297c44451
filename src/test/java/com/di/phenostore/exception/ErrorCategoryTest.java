package com.di.phenostore.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.io.IOException;
import java.net.ConnectException;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    @Test
    @DisplayName("Store exceptions keep their own category")
    void testCategorize_StoreException() {
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new ValidationException("bad")));
        assertEquals(ErrorCategory.EXECUTION_ERROR,
                ErrorCategory.categorize(new RuntimeException(new BackendExecutionException("x", "out"))));
    }

    @Test
    @DisplayName("SQLState class 08 is a connection error")
    void testCategorize_SqlStateConnection() {
        SQLException e = new SQLException("link failure", "08006");
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(e));
        assertEquals(ErrorCategory.CONNECTION_ERROR,
                ErrorCategory.categorize(new UncategorizedSQLException("query", "SELECT 1", e)));
    }

    @Test
    @DisplayName("Other SQL states are execution errors")
    void testCategorize_SqlStateExecution() {
        assertEquals(ErrorCategory.EXECUTION_ERROR, ErrorCategory.categorize(new SQLException("syntax", "42601")));
        assertEquals(ErrorCategory.EXECUTION_ERROR, ErrorCategory.categorize(new SQLException("conversion", "22018")));
        assertEquals(ErrorCategory.EXECUTION_ERROR, ErrorCategory.categorize(new SQLException("no state")));
    }

    @Test
    @DisplayName("Connection messages without a state are connection errors")
    void testCategorize_ConnectionMessage() {
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(new SQLException("Connection refused")));
    }

    @Test
    @DisplayName("Exception types are matched when no SQLException is in the chain")
    void testCategorize_ByType() {
        assertEquals(ErrorCategory.CONNECTION_ERROR,
                ErrorCategory.categorize(new CannotGetJdbcConnectionException("pool exhausted")));
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(new ConnectException("refused")));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalArgumentException("bad")));
        assertEquals(ErrorCategory.EXECUTION_ERROR, ErrorCategory.categorize(new IOException("disk full")));
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(new IllegalStateException("?")));
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Severity rises from validation to connection errors")
    void testSeverity() {
        assertEquals(ErrorCategory.Severity.LOW, ErrorCategory.VALIDATION_ERROR.getSeverity());
        assertEquals(ErrorCategory.Severity.MEDIUM, ErrorCategory.EXECUTION_ERROR.getSeverity());
        assertEquals(ErrorCategory.Severity.HIGH, ErrorCategory.CONNECTION_ERROR.getSeverity());
    }
}
