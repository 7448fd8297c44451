package com.di.phenostore.sql.ast;

/**
 * Row source in a FROM or JOIN clause.
 */
public interface Relation {

    /** Name the relation's columns are qualified with. */
    String reference();

    record Table(String name, String alias) implements Relation {
        public static Table of(String name) {
            return new Table(name, null);
        }

        @Override
        public String reference() {
            return alias != null ? alias : name;
        }
    }

    record Derived(QueryNode query, String alias) implements Relation {
        @Override
        public String reference() {
            return alias;
        }
    }
}
