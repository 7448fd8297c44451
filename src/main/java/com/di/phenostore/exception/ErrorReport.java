package com.di.phenostore.exception;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Structured failure handed to the transport layer.
 */
@Value
@Builder
public class ErrorReport {
    String timestamp;
    String errorCategory;
    String errorCategoryName;
    ErrorCategory.Severity severity;
    String message;
    /** Raw backend diagnostic text, when the backend produced any. */
    String output;
    Map<String, Object> details;
}
