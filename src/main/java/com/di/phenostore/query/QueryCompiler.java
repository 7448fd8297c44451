package com.di.phenostore.query;

import com.di.phenostore.exception.NoMatchingFieldsException;
import com.di.phenostore.exception.ValidationException;
import com.di.phenostore.load.DerivedTablesBuilder;
import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.registry.FieldEntry;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.ast.Expression;
import com.di.phenostore.sql.ast.JoinClause;
import com.di.phenostore.sql.ast.Predicate;
import com.di.phenostore.sql.ast.Projection;
import com.di.phenostore.sql.ast.Relation;
import com.di.phenostore.sql.ast.SelectQuery;
import com.di.phenostore.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a {@link QueryRequest} into a query tree over the minimal set of shard tables.
 * <p>
 * Plain fields are projected from their shard table, expressions and filters are placed
 * in the tree as validated raw SQL. Every projection carries an alias; the subject id
 * comes first as {@code eid} and rows are ordered by it.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryCompiler {

    /** Column of the preferred order table giving each subject's position. */
    public static final String ORDER_COLUMN = "sample_index";

    private static final String ORDER_ALIAS = "s";
    private static final String ORDERED_ALIAS = "u";

    private final FieldRegistry registry;

    /**
     * @throws NoMatchingFieldsException if the request references no registered field
     * @throws ValidationException       on unregistered fields or malformed expressions
     */
    public CompiledQuery compile(QueryRequest request) {
        if (request.getColumns().isEmpty() && request.getRegexColumns().isEmpty()) {
            throw new ValidationException("A query needs at least one column or field regular expression");
        }

        List<ColumnSpec> specs = request.getColumns().stream().map(ColumnSpec::parse).toList();
        List<String> regexFields = registry.matching(request.getRegexColumns());
        if (!request.getRegexColumns().isEmpty() && regexFields.isEmpty()) {
            log.warn("[QUERY] no registered field matches {}", request.getRegexColumns());
        }
        List<String> filters = prepareFilters(request.getFilters());

        Set<String> referenced = new LinkedHashSet<>();
        specs.forEach(s -> referenced.addAll(FieldReferences.in(s.expression())));
        referenced.addAll(regexFields);
        referenced.addAll(FieldReferences.in(filters));
        if (referenced.isEmpty()) {
            throw new NoMatchingFieldsException(request.getRegexColumns());
        }
        Map<String, FieldEntry> entries = registry.resolveAll(referenced);
        Set<String> tables = FieldRegistry.tablesOf(entries.values());

        JoinPlan plan = plan(tables, request.getJoinMode());

        List<Projection> projections = new ArrayList<>();
        List<OutputColumn> columns = new ArrayList<>();
        Set<String> aliases = new HashSet<>();
        projections.add(new Projection(plan.subjectId(), ColumnNaming.SUBJECT_ID));
        aliases.add(ColumnNaming.SUBJECT_ID);

        int generated = 0;
        for (ColumnSpec spec : specs) {
            if (spec.isField()) {
                FieldEntry entry = entries.get(spec.field());
                String alias = spec.alias() != null ? spec.alias() : spec.field();
                claim(aliases, alias);
                projections.add(new Projection(new Expression.Column(entry.getTableName(), spec.field()), alias));
                columns.add(new OutputColumn(spec.label(), alias, entry.getKind()));
            } else {
                String alias = spec.alias();
                if (alias == null) {
                    do {
                        alias = "expr_" + (++generated);
                    } while (aliases.contains(alias));
                }
                claim(aliases, alias);
                projections.add(new Projection(new Expression.Raw(spec.expression()), alias));
                columns.add(new OutputColumn(spec.label(), alias, null));
            }
        }
        for (String field : regexFields) {
            if (aliases.contains(field)) {
                continue;
            }
            aliases.add(field);
            FieldEntry entry = entries.get(field);
            projections.add(new Projection(new Expression.Column(entry.getTableName(), field), field));
            columns.add(new OutputColumn(field, field, entry.getKind()));
        }

        List<Predicate> where = new ArrayList<>();
        if (request.getJoinMode() == JoinMode.OUTER) {
            Predicate exists = plan.anyJoinedRowExists();
            if (exists != null) {
                where.add(exists);
            }
        }
        filters.forEach(f -> where.add(new Predicate.Raw(f)));

        SelectQuery query = SelectQuery.builder()
                .projections(projections)
                .from(plan.from())
                .joins(plan.joins())
                .where(Predicate.allOf(where))
                .orderBy(List.of(plan.subjectId()))
                .build();

        log.info("[QUERY] {} column(s) over {} shard table(s), {} filter(s), {} join",
                columns.size(), tables.size(), filters.size(), request.getJoinMode());
        return new CompiledQuery(query, columns);
    }

    /**
     * Validates filter predicates and drops blank ones.
     *
     * @throws ValidationException if a filter fails the expression check
     */
    public List<String> prepareFilters(List<String> filters) {
        if (filters == null) {
            return List.of();
        }
        return filters.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> InputValidator.validateExpression(f, "filter"))
                .toList();
    }

    /**
     * Re-orders a compiled query's rows by a preferred order table with columns
     * {@code (sample_index, eid)}. Every subject of the order table appears once, in
     * order; subjects absent from the query get nulls, subjects absent from the order
     * table are dropped.
     */
    public CompiledQuery withPreferredOrder(CompiledQuery compiled, String orderTable) {
        String table = InputValidator.validateIdentifier(orderTable, "order table").toLowerCase(Locale.ROOT);
        Expression.Column subjectId = new Expression.Column(ORDER_ALIAS, ColumnNaming.SUBJECT_ID);

        List<Projection> projections = new ArrayList<>();
        projections.add(new Projection(subjectId, ColumnNaming.SUBJECT_ID));
        for (OutputColumn c : compiled.columns()) {
            projections.add(new Projection(new Expression.Column(ORDERED_ALIAS, c.alias()), c.alias()));
        }
        JoinPlan plan = JoinPlan.over(new Relation.Table(table, ORDER_ALIAS),
                List.of(new Relation.Derived(compiled.unordered(), ORDERED_ALIAS)),
                JoinClause.JoinType.LEFT_OUTER);

        SelectQuery query = SelectQuery.builder()
                .projections(projections)
                .from(plan.from())
                .joins(plan.joins())
                .orderBy(List.of(new Expression.Column(ORDER_ALIAS, ORDER_COLUMN)))
                .build();
        log.debug("[QUERY] rows re-ordered by {}", table);
        return new CompiledQuery(query, compiled.columns());
    }

    private static JoinPlan plan(Set<String> tables, JoinMode mode) {
        if (mode == JoinMode.OUTER) {
            return JoinPlan.overTables(Relation.Table.of(DerivedTablesBuilder.ANCHOR_TABLE), tables, JoinClause.JoinType.LEFT_OUTER);
        }
        List<String> ordered = new ArrayList<>(tables);
        return JoinPlan.overTables(Relation.Table.of(ordered.get(0)), ordered.subList(1, ordered.size()), JoinClause.JoinType.INNER);
    }

    private static void claim(Set<String> aliases, String alias) {
        if (!aliases.add(alias)) {
            throw new ValidationException("Duplicate output column name: " + alias);
        }
    }
}
