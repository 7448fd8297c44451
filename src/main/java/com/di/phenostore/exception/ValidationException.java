package com.di.phenostore.exception;

/**
 * Malformed request, unknown section or unregistered field. Raised before any
 * query reaches the backend and never retried.
 */
public class ValidationException extends PhenoStoreException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION_ERROR, message, null, cause);
    }
}
