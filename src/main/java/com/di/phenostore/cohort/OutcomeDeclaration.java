package com.di.phenostore.cohort;

/**
 * How the values of one derived output column are produced. See {@link ExpressionOutcome},
 * {@link CaseControlOutcome} and {@link CategoryOutcome}.
 */
public interface OutcomeDeclaration {
}
