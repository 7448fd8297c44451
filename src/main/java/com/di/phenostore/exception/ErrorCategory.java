package com.di.phenostore.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Closed set of failure categories surfaced to callers.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    VALIDATION_ERROR("Validation error", "Malformed query document, unknown section or unregistered field", Severity.LOW),
    EXECUTION_ERROR("Execution error", "The backend rejected a query or a bulk import", Severity.MEDIUM),
    CONNECTION_ERROR("Connection error", "The backend could not be reached", Severity.HIGH),
    UNKNOWN("Unknown error", "Unclassified failure", Severity.MEDIUM);

    public enum Severity { LOW, MEDIUM, HIGH }

    private final String name;
    private final String description;
    private final Severity severity;

    ErrorCategory(String name, String description, Severity severity) {
        this.name = name;
        this.description = description;
        this.severity = severity;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isConnectionError, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isExecutionError, EXECUTION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "28", CONNECTION_ERROR,
            "57", CONNECTION_ERROR
    );

    /**
     * Categorizes a throwable, looking through its cause chain for a
     * {@link PhenoStoreException} or {@link SQLException} first.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof PhenoStoreException pse) {
                return pse.getCategory();
            }
            if (t instanceof SQLException sqlEx) {
                return categorizeSqlException(sqlEx);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null && containsAny(msg.toLowerCase(), "connection refused", "connection reset", "connection is closed")) {
            return CONNECTION_ERROR;
        }
        return EXECUTION_ERROR;
    }

    private static boolean isConnectionError(Throwable t) {
        return t instanceof CannotGetJdbcConnectionException
                || t instanceof DataAccessResourceFailureException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException;
    }

    private static boolean isExecutionError(Throwable t) {
        return t instanceof org.springframework.dao.DataAccessException
                || t instanceof java.io.IOException;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String n : needles) {
            if (text.contains(n)) {
                return true;
            }
        }
        return false;
    }
}
