package com.di.phenostore.exception;

public class ConnectivityException extends PhenoStoreException {

    public ConnectivityException(String message, String output, Throwable cause) {
        super(ErrorCategory.CONNECTION_ERROR, message, output, cause);
    }
}
