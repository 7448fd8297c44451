package com.di.phenostore.sql.ast;

import java.util.List;

/**
 * Boolean condition in a query tree.
 */
public interface Predicate {

    /** Filter written by a query author, validated before it is placed in the tree. */
    record Raw(String sql) implements Predicate {}

    record And(List<Predicate> operands) implements Predicate {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Or(List<Predicate> operands) implements Predicate {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record Equals(Expression left, Expression right) implements Predicate {}

    record IsNotNull(Expression expression) implements Predicate {}

    record In(Expression expression, List<Expression> values) implements Predicate {
        public In {
            values = List.copyOf(values);
        }
    }

    record NotInQuery(Expression expression, QueryNode query) implements Predicate {}

    /** AND of the operands, or the single operand itself, or null for none. */
    static Predicate allOf(List<Predicate> operands) {
        if (operands.isEmpty()) {
            return null;
        }
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    /** OR of the operands, or the single operand itself. */
    static Predicate anyOf(List<Predicate> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("anyOf needs at least one operand");
        }
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }
}
