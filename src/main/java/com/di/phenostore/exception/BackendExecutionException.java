package com.di.phenostore.exception;

/**
 * The backend rejected a query or a bulk import. {@link #getOutput()} holds the
 * backend's diagnostic text.
 */
public class BackendExecutionException extends PhenoStoreException {

    public BackendExecutionException(String message, String output, Throwable cause) {
        super(ErrorCategory.EXECUTION_ERROR, message, output, cause);
    }

    public BackendExecutionException(String message, String output) {
        this(message, output, null);
    }
}
