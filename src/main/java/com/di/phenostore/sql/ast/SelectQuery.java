package com.di.phenostore.sql.ast;

import lombok.Builder;

import java.util.List;

/**
 * {@code SELECT [DISTINCT] projections FROM from joins [WHERE where] [ORDER BY orderBy]}.
 */
@Builder(toBuilder = true)
public record SelectQuery(boolean distinct,
                          List<Projection> projections,
                          Relation from,
                          List<JoinClause> joins,
                          Predicate where,
                          List<Expression> orderBy) implements QueryNode {

    public SelectQuery {
        if (projections == null || projections.isEmpty()) {
            throw new IllegalArgumentException("A select needs at least one projection");
        }
        if (from == null) {
            throw new IllegalArgumentException("A select needs a row source");
        }
        projections = List.copyOf(projections);
        joins = joins == null ? List.of() : List.copyOf(joins);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }
}
