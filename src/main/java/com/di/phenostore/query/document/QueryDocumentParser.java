package com.di.phenostore.query.document;

import com.di.phenostore.cohort.CaseControlOutcome;
import com.di.phenostore.cohort.CategoryOutcome;
import com.di.phenostore.cohort.ExpressionOutcome;
import com.di.phenostore.cohort.NamedOutcome;
import com.di.phenostore.cohort.OutcomeDeclaration;
import com.di.phenostore.exception.ValidationException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads declarative query documents (YAML).
 * <pre>
 * samples_filters:
 *   - c50_0_0 &gt; 150
 * my_section:
 *   height: c50_0_0
 *   diabetes:
 *     case_control:
 *       84:
 *         coding: [1220, 1223]
 *   smoker:
 *     sql:
 *       0: c20116_0_0 = 0
 *       1: c20116_0_0 in (1, 2)
 * simple_section:
 *   height: c50_0_0
 * </pre>
 * Repeated keys in any mapping are rejected.
 */
@Slf4j
public class QueryDocumentParser {

    static final String CASE_CONTROL = "case_control";
    static final String SQL = "sql";
    static final String CODING = "coding";

    private final ObjectMapper yamlMapper;

    public QueryDocumentParser() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.yamlMapper.enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    }

    public QueryDocument parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new ValidationException("Query document is empty");
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed query document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Query document must be a mapping of sections");
        }

        List<String> filters = List.of();
        Map<String, List<NamedOutcome>> outcomeSections = new LinkedHashMap<>();
        Map<String, Map<String, String>> simpleSections = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> sections = root.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            String name = section.getKey();
            if (QueryDocument.SAMPLES_FILTERS.equals(name)) {
                filters = scalars(section.getValue(), QueryDocument.SAMPLES_FILTERS);
            } else if (QueryDocument.isSimple(name)) {
                simpleSections.put(name, simpleSection(name, section.getValue()));
            } else {
                outcomeSections.put(name, outcomeSection(name, section.getValue()));
            }
        }
        QueryDocument document = new QueryDocument(filters, outcomeSections, simpleSections);
        log.debug("[QUERY] document with {} filter(s), sections {}", filters.size(), document.sectionNames());
        return document;
    }

    private static Map<String, String> simpleSection(String section, JsonNode node) {
        requireMapping(node, "section '" + section + "'");
        Map<String, String> columns = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            if (!e.getValue().isValueNode() || e.getValue().isNull()) {
                throw new ValidationException("Column '" + e.getKey() + "' of section '" + section
                        + "' must be a field or an expression");
            }
            columns.put(e.getKey(), e.getValue().asText());
        });
        return columns;
    }

    private static List<NamedOutcome> outcomeSection(String section, JsonNode node) {
        requireMapping(node, "section '" + section + "'");
        List<NamedOutcome> outcomes = new ArrayList<>();
        node.fields().forEachRemaining(e -> outcomes.add(outcome(section, e.getKey(), e.getValue())));
        return outcomes;
    }

    private static NamedOutcome outcome(String section, String column, JsonNode node) {
        if (node.isValueNode() && !node.isNull()) {
            return NamedOutcome.of(column, new ExpressionOutcome(node.asText()));
        }
        if (!node.isObject() || node.isEmpty()) {
            throw new ValidationException("Invalid query type for column '" + column + "' of section '" + section + "'");
        }
        List<OutcomeDeclaration> declarations = new ArrayList<>();
        node.fields().forEachRemaining(selector -> {
            switch (selector.getKey()) {
                case CASE_CONTROL -> declarations.add(caseControl(column, selector.getValue()));
                case SQL -> declarations.add(categories(column, selector.getValue()));
                default -> throw new ValidationException("Invalid selector type '" + selector.getKey()
                        + "' for column '" + column + "'");
            }
        });
        return new NamedOutcome(column, declarations);
    }

    private static CaseControlOutcome caseControl(String column, JsonNode node) {
        requireMapping(node, "case_control of '" + column + "'");
        Map<Integer, List<String>> codes = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            int fieldId = Math.toIntExact(parseInteger(e.getKey(), "field id of '" + column + "'"));
            JsonNode coding = e.getValue().get(CODING);
            if (coding == null) {
                throw new ValidationException("case_control field " + fieldId + " of '" + column + "' has no coding");
            }
            codes.put(fieldId, scalars(coding, "coding of '" + column + "'"));
        });
        try {
            return new CaseControlOutcome(codes);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage() + " ('" + column + "')", ex);
        }
    }

    private static CategoryOutcome categories(String column, JsonNode node) {
        requireMapping(node, "sql of '" + column + "'");
        List<CategoryOutcome.Category> categories = new ArrayList<>();
        node.fields().forEachRemaining(e -> {
            long value = parseInteger(e.getKey(), "category of '" + column + "'");
            if (!e.getValue().isValueNode() || e.getValue().isNull()) {
                throw new ValidationException("Category " + value + " of '" + column + "' must be a predicate");
            }
            categories.add(new CategoryOutcome.Category(value, e.getValue().asText()));
        });
        try {
            return new CategoryOutcome(categories);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage() + " ('" + column + "')", ex);
        }
    }

    /** A scalar or a list of scalars, as text. */
    private static List<String> scalars(JsonNode node, String what) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> {
                if (!v.isValueNode() || v.isNull()) {
                    throw new ValidationException("Invalid value in " + what + ": " + v);
                }
                values.add(v.asText());
            });
        } else if (node.isValueNode() && !node.isNull()) {
            values.add(node.asText());
        } else {
            throw new ValidationException("Invalid " + what + ": expected a value or a list of values");
        }
        return values;
    }

    private static Long parseInteger(String text, String what) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid " + what + ": '" + text + "' is not an integer", e);
        }
    }

    private static void requireMapping(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Invalid " + what + ": expected a mapping");
        }
    }
}
