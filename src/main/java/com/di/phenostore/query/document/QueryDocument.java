package com.di.phenostore.query.document;

import com.di.phenostore.cohort.NamedOutcome;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parsed declarative query document.
 *
 * @param samplesFilters predicates every section is restricted by
 * @param outcomeSections sections declaring derived outcome columns
 * @param simpleSections  {@code simple_} sections, output name to field or expression
 */
public record QueryDocument(List<String> samplesFilters,
                            Map<String, List<NamedOutcome>> outcomeSections,
                            Map<String, Map<String, String>> simpleSections) {

    public static final String SAMPLES_FILTERS = "samples_filters";
    public static final String SIMPLE_PREFIX = "simple_";

    public QueryDocument {
        samplesFilters = List.copyOf(samplesFilters);
        outcomeSections = Map.copyOf(outcomeSections);
        simpleSections = Map.copyOf(simpleSections);
    }

    public static boolean isSimple(String section) {
        return section.startsWith(SIMPLE_PREFIX);
    }

    public Set<String> sectionNames() {
        java.util.TreeSet<String> names = new java.util.TreeSet<>(outcomeSections.keySet());
        names.addAll(simpleSections.keySet());
        return names;
    }
}
