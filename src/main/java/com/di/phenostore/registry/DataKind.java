package com.di.phenostore.registry;

import java.util.Locale;

/**
 * Storage kind of a field, derived from the declared value type in the data dictionary.
 */
public enum DataKind {
    TEXT,
    INTEGER,
    CONTINUOUS,
    TIMESTAMP;

    /**
     * Maps a declared value type ({@code Integer}, {@code Continuous}, {@code Date},
     * {@code Time}, {@code Categorical (single)}, ...) to a storage kind. Unknown and
     * non-numeric types are text.
     */
    public static DataKind fromDeclaredType(String declaredType) {
        if (declaredType == null) {
            return TEXT;
        }
        return switch (declaredType.trim().toLowerCase(Locale.ROOT)) {
            case "integer" -> INTEGER;
            case "continuous" -> CONTINUOUS;
            case "date", "time" -> TIMESTAMP;
            default -> TEXT;
        };
    }
}
