package com.di.phenostore.sql.ast;

import java.util.List;

/**
 * Duplicate-eliminating {@code UNION} of its branches.
 */
public record UnionQuery(List<SelectQuery> branches) implements QueryNode {

    public UnionQuery {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one branch");
        }
        branches = List.copyOf(branches);
    }
}
