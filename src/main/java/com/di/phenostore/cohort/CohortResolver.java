package com.di.phenostore.cohort;

import com.di.phenostore.exception.ValidationException;
import com.di.phenostore.load.DerivedTablesBuilder;
import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.query.CompiledQuery;
import com.di.phenostore.query.FieldReferences;
import com.di.phenostore.query.JoinMode;
import com.di.phenostore.query.JoinPlan;
import com.di.phenostore.query.OutputColumn;
import com.di.phenostore.query.QueryCompiler;
import com.di.phenostore.query.QueryRequest;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.ast.Expression;
import com.di.phenostore.sql.ast.JoinClause;
import com.di.phenostore.sql.ast.Predicate;
import com.di.phenostore.sql.ast.Projection;
import com.di.phenostore.sql.ast.Relation;
import com.di.phenostore.sql.ast.SelectQuery;
import com.di.phenostore.sql.ast.UnionQuery;
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
 * Builds one derived table per named outcome and joins them on subject id.
 * <p>
 * The result has the subject id followed by one text column per outcome. A subject
 * appears when at least one derived table has a row for it; the others contribute nulls.
 */
@Slf4j
@RequiredArgsConstructor
public class CohortResolver {

    static final String EVENTS_ALIAS = "ev";
    static final String DERIVED_ALIAS_PREFIX = "iq";

    private final FieldRegistry registry;
    private final QueryCompiler compiler;

    public CompiledQuery resolve(List<NamedOutcome> outcomes, List<String> filters) {
        if (outcomes == null || outcomes.isEmpty()) {
            throw new ValidationException("A cohort query needs at least one outcome column");
        }
        List<String> globalFilters = compiler.prepareFilters(filters);
        Set<String> filterTables = registry.tablesFor(FieldReferences.in(globalFilters));

        List<Relation> derived = new ArrayList<>();
        List<OutputColumn> columns = new ArrayList<>();
        Set<String> names = new HashSet<>();
        names.add(ColumnNaming.SUBJECT_ID);

        for (NamedOutcome outcome : outcomes) {
            String name = InputValidator.validateIdentifier(outcome.name(), "outcome name").toLowerCase(Locale.ROOT);
            if (!names.add(name)) {
                throw new ValidationException("Duplicate outcome column: " + name);
            }
            List<SelectQuery> legs = new ArrayList<>();
            for (OutcomeDeclaration declaration : outcome.declarations()) {
                legs.addAll(legsOf(name, declaration, globalFilters, filterTables));
            }
            SelectQuery single = legs.size() == 1 ? legs.get(0) : null;
            derived.add(new Relation.Derived(single != null ? single : new UnionQuery(legs),
                    DERIVED_ALIAS_PREFIX + derived.size()));
            columns.add(new OutputColumn(name, name, null));
        }

        JoinPlan plan = JoinPlan.over(Relation.Table.of(DerivedTablesBuilder.ANCHOR_TABLE), derived,
                JoinClause.JoinType.LEFT_OUTER);
        List<Projection> projections = new ArrayList<>();
        projections.add(new Projection(plan.subjectId(), ColumnNaming.SUBJECT_ID));
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).alias();
            projections.add(new Projection(
                    new Expression.CastToText(new Expression.Column(plan.joined().get(i), name)), name));
        }

        SelectQuery query = SelectQuery.builder()
                .projections(projections)
                .from(plan.from())
                .joins(plan.joins())
                .where(plan.anyJoinedRowExists())
                .orderBy(List.of(plan.subjectId()))
                .build();
        log.info("[COHORT] {} outcome column(s), {} global filter(s)", columns.size(), globalFilters.size());
        return new CompiledQuery(query, columns);
    }

    private List<SelectQuery> legsOf(String name, OutcomeDeclaration declaration,
                                     List<String> filters, Set<String> filterTables) {
        if (declaration instanceof ExpressionOutcome e) {
            return List.of(expression(name, e, filters));
        }
        if (declaration instanceof CaseControlOutcome cc) {
            return caseControl(name, cc, filters, filterTables);
        }
        if (declaration instanceof CategoryOutcome cat) {
            return List.of(categories(name, cat, filters));
        }
        throw new ValidationException("Unsupported outcome declaration " + declaration.getClass().getSimpleName());
    }

    private SelectQuery expression(String name, ExpressionOutcome outcome, List<String> filters) {
        QueryRequest request = QueryRequest.builder()
                .column("(" + outcome.expression() + ") as " + name)
                .filters(filters)
                .joinMode(JoinMode.OUTER)
                .build();
        return compiler.compile(request).unordered();
    }

    /**
     * Case leg: subjects with any listed (field, code) event. Control leg: every other
     * anchored subject. Both legs honour the global filters.
     */
    private List<SelectQuery> caseControl(String name, CaseControlOutcome outcome,
                                          List<String> filters, Set<String> filterTables) {
        List<Predicate> anyEvent = new ArrayList<>();
        for (Map.Entry<Integer, List<String>> e : outcome.codesByField().entrySet()) {
            anyEvent.add(new Predicate.And(List.of(
                    new Predicate.Equals(Expression.Column.of("field_id"), new Expression.Parameter(e.getKey())),
                    new Predicate.In(Expression.Column.of("event"),
                            e.getValue().stream().<Expression>map(Expression.Parameter::new).toList()))));
        }
        SelectQuery cases = SelectQuery.builder()
                .distinct(true)
                .projections(List.of(new Projection(Expression.Column.of(ColumnNaming.SUBJECT_ID), null)))
                .from(Relation.Table.of(DerivedTablesBuilder.EVENTS_TABLE))
                .where(Predicate.anyOf(anyEvent))
                .build();

        List<Predicate> filterPredicates = filters.stream().<Predicate>map(Predicate.Raw::new).toList();

        JoinPlan caseJoins = JoinPlan.overTables(new Relation.Derived(cases, EVENTS_ALIAS), filterTables,
                JoinClause.JoinType.INNER);
        SelectQuery caseLeg = SelectQuery.builder()
                .projections(List.of(
                        new Projection(caseJoins.subjectId(), ColumnNaming.SUBJECT_ID),
                        new Projection(new Expression.IntegerLiteral(1), name)))
                .from(caseJoins.from())
                .joins(caseJoins.joins())
                .where(Predicate.allOf(filterPredicates))
                .build();

        JoinPlan controlJoins = JoinPlan.overTables(Relation.Table.of(DerivedTablesBuilder.ANCHOR_TABLE), filterTables,
                JoinClause.JoinType.INNER);
        List<Predicate> controlWhere = new ArrayList<>(filterPredicates);
        controlWhere.add(new Predicate.NotInQuery(controlJoins.subjectId(), cases));
        SelectQuery controlLeg = SelectQuery.builder()
                .projections(List.of(
                        new Projection(controlJoins.subjectId(), ColumnNaming.SUBJECT_ID),
                        new Projection(new Expression.IntegerLiteral(0), name)))
                .from(controlJoins.from())
                .joins(controlJoins.joins())
                .where(Predicate.allOf(controlWhere))
                .build();

        log.debug("[COHORT] {}: case/control over field(s) {}", name, outcome.codesByField().keySet());
        return List.of(caseLeg, controlLeg);
    }

    /**
     * One row per subject satisfying any category predicate. Arms are tested in reverse
     * declaration order so the last declared matching category is the value.
     */
    private SelectQuery categories(String name, CategoryOutcome outcome, List<String> filters) {
        List<String> predicates = outcome.categories().stream()
                .map(c -> InputValidator.validateExpression(c.predicate(), "category predicate"))
                .toList();

        Set<String> fields = new LinkedHashSet<>(FieldReferences.in(predicates));
        fields.addAll(FieldReferences.in(filters));
        JoinPlan plan = JoinPlan.overTables(Relation.Table.of(DerivedTablesBuilder.ANCHOR_TABLE),
                registry.tablesFor(fields), JoinClause.JoinType.LEFT_OUTER);

        List<Expression.WhenThen> arms = new ArrayList<>();
        for (int i = predicates.size() - 1; i >= 0; i--) {
            arms.add(new Expression.WhenThen(new Predicate.Raw(predicates.get(i)),
                    new Expression.IntegerLiteral(outcome.categories().get(i).value())));
        }

        List<Predicate> where = new ArrayList<>();
        where.add(Predicate.anyOf(predicates.stream().<Predicate>map(Predicate.Raw::new).toList()));
        filters.forEach(f -> where.add(new Predicate.Raw(f)));

        return SelectQuery.builder()
                .projections(List.of(
                        new Projection(plan.subjectId(), ColumnNaming.SUBJECT_ID),
                        new Projection(new Expression.CaseWhen(arms), name)))
                .from(plan.from())
                .joins(plan.joins())
                .where(Predicate.allOf(where))
                .build();
    }
}
