package com.di.phenostore.query;

import com.di.phenostore.cohort.CohortResolver;
import com.di.phenostore.cohort.NamedOutcome;
import com.di.phenostore.config.QuerySettings;
import com.di.phenostore.exception.ErrorTranslator;
import com.di.phenostore.exception.ValidationException;
import com.di.phenostore.query.document.QueryDocument;
import com.di.phenostore.query.document.QueryDocumentParser;
import com.di.phenostore.registry.FieldEntry;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.stream.QueryResult;
import com.di.phenostore.stream.ResultCursor;
import com.di.phenostore.stream.ResultStreamer;
import com.di.phenostore.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for phenotype queries. Every failure leaving this class is a
 * {@link com.di.phenostore.exception.PhenoStoreException}.
 */
@Slf4j
@RequiredArgsConstructor
public class PhenotypeQueryService {

    private final FieldRegistry registry;
    private final QueryCompiler compiler;
    private final CohortResolver cohortResolver;
    private final QueryDocumentParser documentParser;
    private final ResultStreamer streamer;
    private final QuerySettings settings;

    public List<FieldEntry> listFields() {
        try {
            return registry.entries();
        } catch (RuntimeException e) {
            throw ErrorTranslator.translate(e);
        }
    }

    public QueryResult query(QueryRequest request) {
        return query(request, null, null);
    }

    /**
     * @param missingCode sentinel for missing values, {@code null} for the configured default
     * @param orderTable  preferred order table, {@code null} to keep subject id order
     */
    public QueryResult query(QueryRequest request, String missingCode, String orderTable) {
        try {
            log.info("[QUERY] columns={} regex={} filters={} mode={}", request.getColumns(),
                    request.getRegexColumns(), request.getFilters().size(), request.getJoinMode());
            return open(compiler.compile(request), missingCode, orderTable);
        } catch (RuntimeException e) {
            throw ErrorTranslator.translate(e);
        }
    }

    public QueryResult queryDocument(String yaml, String section) {
        return queryDocument(yaml, section, null, null);
    }

    /**
     * Runs one section of a declarative query document. {@code simple_} sections select
     * fields directly; any other section derives outcome columns.
     */
    public QueryResult queryDocument(String yaml, String section, String missingCode, String orderTable) {
        try {
            if (section == null || section.isBlank()) {
                throw new ValidationException("No query document section given");
            }
            QueryDocument document = documentParser.parse(yaml);
            log.info("[QUERY] document section '{}'", InputValidator.sanitizeForLogging(section));

            if (QueryDocument.isSimple(section)) {
                Map<String, String> simple = document.simpleSections().get(section);
                if (simple == null) {
                    throw new ValidationException("Section not found in query document: " + section);
                }
                List<String> columns = new ArrayList<>();
                simple.forEach((name, expression) -> columns.add(
                        "(" + expression + ") as " + InputValidator.validateIdentifier(name, "column name")));
                QueryRequest request = QueryRequest.builder()
                        .columns(columns)
                        .filters(document.samplesFilters())
                        .joinMode(JoinMode.INNER)
                        .build();
                return open(compiler.compile(request), missingCode, orderTable);
            }

            List<NamedOutcome> outcomes = document.outcomeSections().get(section);
            if (outcomes == null) {
                throw new ValidationException("Section not found in query document: " + section);
            }
            return open(cohortResolver.resolve(outcomes, document.samplesFilters()), missingCode, orderTable);
        } catch (RuntimeException e) {
            throw ErrorTranslator.translate(e);
        }
    }

    /** Name of the configured preferred order table. */
    public String preferredOrderTable() {
        return settings.orderTable();
    }

    private QueryResult open(CompiledQuery compiled, String missingCode, String orderTable) {
        CompiledQuery effective = orderTable == null ? compiled : compiler.withPreferredOrder(compiled, orderTable);
        ResultCursor cursor = streamer.open(effective);
        return new QueryResult(cursor.columns(), cursor,
                missingCode != null ? missingCode : settings.missingCode(), orderTable);
    }
}
