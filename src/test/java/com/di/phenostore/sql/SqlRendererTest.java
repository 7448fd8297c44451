package com.di.phenostore.sql;

import com.di.phenostore.sql.ast.Expression;
import com.di.phenostore.sql.ast.JoinClause;
import com.di.phenostore.sql.ast.Predicate;
import com.di.phenostore.sql.ast.Projection;
import com.di.phenostore.sql.ast.Relation;
import com.di.phenostore.sql.ast.SelectQuery;
import com.di.phenostore.sql.ast.UnionQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlRenderer Tests")
class SqlRendererTest {

    private final SqlRenderer h2 = new SqlRenderer(BackendDialect.H2);
    private final SqlRenderer postgres = new SqlRenderer(BackendDialect.POSTGRESQL);

    private static final Expression.Column T_EID = new Expression.Column("t", "eid");

    @Test
    @DisplayName("Select with join, filters and ordering")
    void testRender_Select() {
        SelectQuery query = SelectQuery.builder()
                .projections(List.of(
                        new Projection(T_EID, "eid"),
                        new Projection(new Expression.Raw("c1_0_0 * 2"), "x")))
                .from(Relation.Table.of("t"))
                .joins(List.of(new JoinClause(JoinClause.JoinType.INNER, Relation.Table.of("u"),
                        new Predicate.Equals(new Expression.Column("u", "eid"), T_EID))))
                .where(new Predicate.And(List.of(
                        new Predicate.Raw("a > 1"),
                        new Predicate.Or(List.of(new Predicate.Raw("b"), new Predicate.Raw("c"))))))
                .orderBy(List.of(T_EID))
                .build();

        RenderedQuery rendered = h2.render(query);

        assertEquals("SELECT t.eid AS eid, (c1_0_0 * 2) AS x FROM t INNER JOIN u ON u.eid = t.eid"
                + " WHERE (a > 1) AND ((b) OR (c)) ORDER BY t.eid", rendered.sql());
        assertTrue(rendered.parameters().isEmpty());
    }

    @Test
    @DisplayName("Literal values become positional parameters in textual order")
    void testRender_Parameters() {
        SelectQuery cases = SelectQuery.builder()
                .distinct(true)
                .projections(List.of(new Projection(Expression.Column.of("eid"), null)))
                .from(Relation.Table.of("events"))
                .where(new Predicate.Or(List.of(
                        new Predicate.And(List.of(
                                new Predicate.Equals(Expression.Column.of("field_id"), new Expression.Parameter(41270)),
                                new Predicate.In(Expression.Column.of("event"),
                                        List.of(new Expression.Parameter("E11"), new Expression.Parameter("J45"))))),
                        new Predicate.And(List.of(
                                new Predicate.Equals(Expression.Column.of("field_id"), new Expression.Parameter(20002)),
                                new Predicate.In(Expression.Column.of("event"),
                                        List.of(new Expression.Parameter("1220"))))))))
                .build();

        RenderedQuery rendered = h2.render(cases);

        assertEquals("SELECT DISTINCT eid FROM events WHERE (field_id = ? AND event IN (?, ?))"
                + " OR (field_id = ? AND event IN (?))", rendered.sql());
        assertEquals(List.of(41270, "E11", "J45", 20002, "1220"), rendered.parameters());
    }

    @Test
    @DisplayName("Union of derived and anchored legs with NOT IN subquery")
    void testRender_UnionAndNotIn() {
        SelectQuery cases = SelectQuery.builder()
                .distinct(true)
                .projections(List.of(new Projection(Expression.Column.of("eid"), null)))
                .from(Relation.Table.of("events"))
                .where(new Predicate.Equals(Expression.Column.of("field_id"), new Expression.Parameter(84)))
                .build();
        SelectQuery caseLeg = SelectQuery.builder()
                .projections(List.of(new Projection(new Expression.Column("ev", "eid"), "eid"),
                        new Projection(new Expression.IntegerLiteral(1), "flag")))
                .from(new Relation.Derived(cases, "ev"))
                .build();
        SelectQuery controlLeg = SelectQuery.builder()
                .projections(List.of(new Projection(new Expression.Column("all_eids", "eid"), "eid"),
                        new Projection(new Expression.IntegerLiteral(0), "flag")))
                .from(Relation.Table.of("all_eids"))
                .where(new Predicate.NotInQuery(new Expression.Column("all_eids", "eid"), cases))
                .build();

        RenderedQuery rendered = h2.render(new UnionQuery(List.of(caseLeg, controlLeg)));

        assertEquals("SELECT ev.eid AS eid, 1 AS flag FROM (SELECT DISTINCT eid FROM events WHERE field_id = ?) ev"
                + " UNION SELECT all_eids.eid AS eid, 0 AS flag FROM all_eids"
                + " WHERE all_eids.eid NOT IN (SELECT DISTINCT eid FROM events WHERE field_id = ?)", rendered.sql());
        assertEquals(List.of(84, 84), rendered.parameters());
    }

    @Test
    @DisplayName("Text casts use the dialect's text type")
    void testRender_CastToText() {
        SelectQuery query = SelectQuery.builder()
                .projections(List.of(new Projection(
                        new Expression.CastToText(new Expression.Column("iq0", "smoker")), "smoker")))
                .from(Relation.Table.of("all_eids"))
                .joins(List.of(new JoinClause(JoinClause.JoinType.LEFT_OUTER, new Relation.Table("x", "iq0"),
                        new Predicate.IsNotNull(new Expression.Column("iq0", "eid")))))
                .build();

        assertEquals("SELECT CAST(iq0.smoker AS VARCHAR) AS smoker FROM all_eids LEFT OUTER JOIN x iq0 ON iq0.eid IS NOT NULL",
                h2.render(query).sql());
        assertTrue(postgres.render(query).sql().startsWith("SELECT CAST(iq0.smoker AS TEXT) AS smoker"));
    }

    @Test
    @DisplayName("CASE arms render in the given order")
    void testRender_CaseWhen() {
        Expression caseWhen = new Expression.CaseWhen(List.of(
                new Expression.WhenThen(new Predicate.Raw("c1_0_0 = 2"), new Expression.IntegerLiteral(2)),
                new Expression.WhenThen(new Predicate.Raw("c1_0_0 >= 0"), new Expression.IntegerLiteral(1))));
        SelectQuery query = SelectQuery.builder()
                .projections(List.of(new Projection(caseWhen, "cat")))
                .from(Relation.Table.of("t"))
                .build();

        assertEquals("SELECT CASE WHEN (c1_0_0 = 2) THEN 2 WHEN (c1_0_0 >= 0) THEN 1 END AS cat FROM t",
                h2.render(query).sql());
    }

    @Test
    @DisplayName("A select needs projections and a row source")
    void testSelectQuery_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> SelectQuery.builder()
                .projections(List.of()).from(Relation.Table.of("t")).build());
        assertThrows(IllegalArgumentException.class, () -> SelectQuery.builder()
                .projections(List.of(new Projection(T_EID, null))).build());
    }

    @Test
    @DisplayName("Node types the renderer does not know are rejected by name")
    void testRender_UnknownNodes() {
        Expression custom = new Expression() {};
        SelectQuery withExpression = SelectQuery.builder()
                .projections(List.of(new Projection(custom, "x")))
                .from(Relation.Table.of("t"))
                .build();
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> h2.render(withExpression));
        assertTrue(ex.getMessage().startsWith("Unsupported expression"));

        Relation customRelation = () -> "r";
        SelectQuery withRelation = SelectQuery.builder()
                .projections(List.of(new Projection(T_EID, "eid")))
                .from(customRelation)
                .build();
        ex = assertThrows(IllegalArgumentException.class, () -> postgres.render(withRelation));
        assertTrue(ex.getMessage().startsWith("Unsupported relation"));
    }
}
