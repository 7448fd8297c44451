package com.di.phenostore.query;

import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.sql.ast.Expression;
import com.di.phenostore.sql.ast.JoinClause;
import com.di.phenostore.sql.ast.Predicate;
import com.di.phenostore.sql.ast.Relation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A row source joined left to right with further relations on subject id equality.
 *
 * @param from      the base relation
 * @param joins     the join chain, each {@code rel.eid = base.eid}
 * @param subjectId the base relation's subject id column
 * @param joined    references of the joined relations, in order
 */
public record JoinPlan(Relation from, List<JoinClause> joins, Expression.Column subjectId, List<String> joined) {

    public static JoinPlan over(Relation base, Collection<? extends Relation> relations, JoinClause.JoinType type) {
        Expression.Column subjectId = new Expression.Column(base.reference(), ColumnNaming.SUBJECT_ID);
        List<JoinClause> joins = new ArrayList<>();
        List<String> joined = new ArrayList<>();
        for (Relation r : relations) {
            joins.add(new JoinClause(type, r,
                    new Predicate.Equals(new Expression.Column(r.reference(), ColumnNaming.SUBJECT_ID), subjectId)));
            joined.add(r.reference());
        }
        return new JoinPlan(base, joins, subjectId, joined);
    }

    public static JoinPlan overTables(Relation base, Collection<String> tables, JoinClause.JoinType type) {
        return over(base, tables.stream().map(Relation.Table::of).toList(), type);
    }

    /**
     * At least one joined relation has a row for the subject. Together with an anchor base
     * and left outer joins, this turns the chain into the equivalent of a full outer join.
     *
     * @return the predicate, or {@code null} when nothing is joined
     */
    public Predicate anyJoinedRowExists() {
        if (joined.isEmpty()) {
            return null;
        }
        return Predicate.anyOf(joined.stream()
                .<Predicate>map(ref -> new Predicate.IsNotNull(new Expression.Column(ref, ColumnNaming.SUBJECT_ID)))
                .toList());
    }
}
