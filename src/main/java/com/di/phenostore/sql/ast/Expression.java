package com.di.phenostore.sql.ast;

import java.util.List;

/**
 * Value expression in a query tree.
 */
public interface Expression {

    /** {@code qualifier.name}, or just {@code name} when the qualifier is null. */
    record Column(String qualifier, String name) implements Expression {
        public static Column of(String name) {
            return new Column(null, name);
        }
    }

    /**
     * Expression written by a query author over field names, validated before it is
     * placed in the tree. Rendered parenthesized.
     */
    record Raw(String sql) implements Expression {}

    record IntegerLiteral(long value) implements Expression {}

    /** Value bound as a statement parameter. */
    record Parameter(Object value) implements Expression {}

    record CastToText(Expression expression) implements Expression {}

    /** {@code CASE WHEN .. THEN .. END}; the first matching arm wins. */
    record CaseWhen(List<WhenThen> arms) implements Expression {
        public CaseWhen {
            arms = List.copyOf(arms);
        }
    }

    record WhenThen(Predicate when, Expression then) {}
}
