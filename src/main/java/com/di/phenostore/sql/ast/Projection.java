package com.di.phenostore.sql.ast;

/**
 * One item of a select list; {@code alias} may be null.
 */
public record Projection(Expression expression, String alias) {}
