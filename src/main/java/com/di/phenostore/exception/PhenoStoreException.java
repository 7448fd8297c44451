package com.di.phenostore.exception;

import lombok.Getter;

/**
 * Base of every failure the store surfaces to its callers. Carries the category and,
 * where the backend produced any, its raw diagnostic output.
 */
@Getter
public class PhenoStoreException extends RuntimeException {

    private final ErrorCategory category;
    private final String output;

    public PhenoStoreException(ErrorCategory category, String message, String output, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.output = output;
    }

    public PhenoStoreException(ErrorCategory category, String message) {
        this(category, message, null, null);
    }
}
