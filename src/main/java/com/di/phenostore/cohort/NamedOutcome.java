package com.di.phenostore.cohort;

import java.util.List;

/**
 * One output column of a cohort query. When several declarations are given, the column
 * holds the distinct union of their rows.
 */
public record NamedOutcome(String name, List<OutcomeDeclaration> declarations) {

    public NamedOutcome {
        if (declarations == null || declarations.isEmpty()) {
            throw new IllegalArgumentException("outcome '" + name + "' has no declaration");
        }
        declarations = List.copyOf(declarations);
    }

    public static NamedOutcome of(String name, OutcomeDeclaration declaration) {
        return new NamedOutcome(name, List.of(declaration));
    }
}
