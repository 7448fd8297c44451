package com.di.phenostore.sql.ast;

/**
 * A complete query: a {@link SelectQuery} or a {@link UnionQuery}.
 */
public interface QueryNode {
}
