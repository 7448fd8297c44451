package com.di.phenostore.exception;

import java.util.List;

/**
 * A non-empty request that references no registered field at all, typically a set of
 * field regular expressions that match nothing.
 */
public class NoMatchingFieldsException extends ValidationException {

    private final List<String> patterns;

    public NoMatchingFieldsException(List<String> patterns) {
        super("No matching fields" + (patterns.isEmpty() ? "" : " for " + patterns));
        this.patterns = List.copyOf(patterns);
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
