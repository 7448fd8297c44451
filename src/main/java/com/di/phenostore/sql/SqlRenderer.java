package com.di.phenostore.sql;

import com.di.phenostore.sql.ast.Expression;
import com.di.phenostore.sql.ast.JoinClause;
import com.di.phenostore.sql.ast.Predicate;
import com.di.phenostore.sql.ast.Projection;
import com.di.phenostore.sql.ast.QueryNode;
import com.di.phenostore.sql.ast.Relation;
import com.di.phenostore.sql.ast.SelectQuery;
import com.di.phenostore.sql.ast.UnionQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits SQL for a query tree in a backend's dialect. Literal values never enter the
 * SQL text; they become positional parameters.
 */
public class SqlRenderer {

    private final BackendDialect dialect;

    public SqlRenderer(BackendDialect dialect) {
        this.dialect = dialect;
    }

    public RenderedQuery render(QueryNode query) {
        StringBuilder sql = new StringBuilder(256);
        List<Object> params = new ArrayList<>();
        query(query, sql, params);
        return new RenderedQuery(sql.toString(), params);
    }

    private void query(QueryNode node, StringBuilder sql, List<Object> params) {
        if (node instanceof SelectQuery select) {
            select(select, sql, params);
        } else if (node instanceof UnionQuery union) {
            for (int i = 0; i < union.branches().size(); i++) {
                if (i > 0) sql.append(" UNION ");
                select(union.branches().get(i), sql, params);
            }
        } else {
            throw new IllegalArgumentException("Unsupported query node " + node.getClass().getSimpleName());
        }
    }

    private void select(SelectQuery q, StringBuilder sql, List<Object> params) {
        sql.append("SELECT ");
        if (q.distinct()) sql.append("DISTINCT ");
        for (int i = 0; i < q.projections().size(); i++) {
            if (i > 0) sql.append(", ");
            Projection p = q.projections().get(i);
            expression(p.expression(), sql, params);
            if (p.alias() != null) {
                sql.append(" AS ").append(p.alias());
            }
        }
        sql.append(" FROM ");
        relation(q.from(), sql, params);
        for (JoinClause join : q.joins()) {
            sql.append(' ').append(join.type().keyword()).append(' ');
            relation(join.relation(), sql, params);
            sql.append(" ON ");
            predicate(join.on(), sql, params, false);
        }
        if (q.where() != null) {
            sql.append(" WHERE ");
            predicate(q.where(), sql, params, true);
        }
        if (!q.orderBy().isEmpty()) {
            sql.append(" ORDER BY ");
            for (int i = 0; i < q.orderBy().size(); i++) {
                if (i > 0) sql.append(", ");
                expression(q.orderBy().get(i), sql, params);
            }
        }
    }

    private void relation(Relation r, StringBuilder sql, List<Object> params) {
        if (r instanceof Relation.Table t) {
            sql.append(t.name());
            if (t.alias() != null) sql.append(' ').append(t.alias());
        } else if (r instanceof Relation.Derived d) {
            sql.append('(');
            query(d.query(), sql, params);
            sql.append(") ").append(d.alias());
        } else {
            throw new IllegalArgumentException("Unsupported relation " + r.getClass().getSimpleName());
        }
    }

    private void expression(Expression e, StringBuilder sql, List<Object> params) {
        if (e instanceof Expression.Column c) {
            if (c.qualifier() != null) sql.append(c.qualifier()).append('.');
            sql.append(c.name());
        } else if (e instanceof Expression.Raw raw) {
            sql.append('(').append(raw.sql()).append(')');
        } else if (e instanceof Expression.IntegerLiteral lit) {
            sql.append(lit.value());
        } else if (e instanceof Expression.Parameter p) {
            sql.append('?');
            params.add(p.value());
        } else if (e instanceof Expression.CastToText cast) {
            sql.append("CAST(");
            expression(cast.expression(), sql, params);
            sql.append(" AS ").append(dialect.textType()).append(')');
        } else if (e instanceof Expression.CaseWhen cw) {
            sql.append("CASE");
            for (Expression.WhenThen arm : cw.arms()) {
                sql.append(" WHEN ");
                predicate(arm.when(), sql, params, false);
                sql.append(" THEN ");
                expression(arm.then(), sql, params);
            }
            sql.append(" END");
        } else {
            throw new IllegalArgumentException("Unsupported expression " + e.getClass().getSimpleName());
        }
    }

    /**
     * @param top {@code true} for a WHERE clause root, which needs no enclosing parentheses
     */
    private void predicate(Predicate p, StringBuilder sql, List<Object> params, boolean top) {
        if (p instanceof Predicate.Raw raw) {
            sql.append('(').append(raw.sql()).append(')');
        } else if (p instanceof Predicate.And and) {
            junction(and.operands(), " AND ", sql, params, top);
        } else if (p instanceof Predicate.Or or) {
            junction(or.operands(), " OR ", sql, params, top);
        } else if (p instanceof Predicate.Equals eq) {
            expression(eq.left(), sql, params);
            sql.append(" = ");
            expression(eq.right(), sql, params);
        } else if (p instanceof Predicate.IsNotNull nn) {
            expression(nn.expression(), sql, params);
            sql.append(" IS NOT NULL");
        } else if (p instanceof Predicate.In in) {
            expression(in.expression(), sql, params);
            sql.append(" IN (");
            for (int i = 0; i < in.values().size(); i++) {
                if (i > 0) sql.append(", ");
                expression(in.values().get(i), sql, params);
            }
            sql.append(')');
        } else if (p instanceof Predicate.NotInQuery notIn) {
            expression(notIn.expression(), sql, params);
            sql.append(" NOT IN (");
            query(notIn.query(), sql, params);
            sql.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported predicate " + p.getClass().getSimpleName());
        }
    }

    private void junction(List<Predicate> operands, String op, StringBuilder sql, List<Object> params, boolean top) {
        if (!top) sql.append('(');
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sql.append(op);
            predicate(operands.get(i), sql, params, false);
        }
        if (!top) sql.append(')');
    }
}
