package com.di.phenostore.exception;

import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates any failure at the service boundary into one of the {@link ErrorCategory}
 * classes, either as a typed {@link PhenoStoreException} or as an {@link ErrorReport}.
 */
@Slf4j
public final class ErrorTranslator {

    private ErrorTranslator() {}

    /**
     * Returns {@code t} itself when it already is a {@link PhenoStoreException}; otherwise
     * wraps it in the exception type of its category, carrying the backend's message as output.
     */
    public static PhenoStoreException translate(Throwable t) {
        if (t instanceof PhenoStoreException pse) {
            return pse;
        }
        ErrorCategory category = ErrorCategory.categorize(t);
        String output = backendOutput(t);
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return switch (category) {
            case VALIDATION_ERROR -> new ValidationException(message, t);
            case CONNECTION_ERROR -> new ConnectivityException("Backend unreachable: " + firstLine(message), output, t);
            case EXECUTION_ERROR -> new BackendExecutionException("Backend error: " + firstLine(message), output, t);
            case UNKNOWN -> new PhenoStoreException(ErrorCategory.UNKNOWN, message, output, t);
        };
    }

    /**
     * Builds the structured report for a failure and logs it once.
     */
    public static ErrorReport toReport(Throwable t) {
        PhenoStoreException e = translate(t);
        ErrorCategory category = e.getCategory();

        Map<String, Object> details = new LinkedHashMap<>();
        Throwable root = rootCause(t);
        details.put("exceptionType", t.getClass().getName());
        if (root != t) {
            details.put("rootCauseType", root.getClass().getName());
            details.put("rootCauseMessage", root.getMessage());
        }
        if (root instanceof SQLException sqlEx) {
            details.put("sqlState", sqlEx.getSQLState());
            details.put("errorCode", sqlEx.getErrorCode());
        }

        if (category.getSeverity() == ErrorCategory.Severity.HIGH) {
            log.error("[ERROR] {} [{}]", e.getMessage(), category.getName(), t);
        } else {
            log.warn("[ERROR] {} [{}]", e.getMessage(), category.getName());
        }

        return ErrorReport.builder()
                .timestamp(Instant.now().toString())
                .errorCategory(category.name())
                .errorCategoryName(category.getName())
                .severity(category.getSeverity())
                .message(e.getMessage())
                .output(e.getOutput())
                .details(details)
                .build();
    }

    private static String backendOutput(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SQLException) {
                return c.getMessage();
            }
            if (c.getCause() == c) {
                break;
            }
        }
        return null;
    }

    private static Throwable rootCause(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String firstLine(String message) {
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
