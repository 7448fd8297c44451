package com.di.phenostore.cohort;

/**
 * The column is a field or an expression over fields.
 */
public record ExpressionOutcome(String expression) implements OutcomeDeclaration {

    public ExpressionOutcome {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("expression must not be blank");
        }
    }
}
