package com.di.phenostore.sql.ast;

public record JoinClause(JoinType type, Relation relation, Predicate on) {

    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT_OUTER("LEFT OUTER JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
