package com.di.phenostore.cohort;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary outcome from the event table. A subject is a case (1) when it has any of the listed
 * codes for any of the listed fields, otherwise a control (0).
 *
 * @param codesByField field id to the event codes that make a case
 */
public record CaseControlOutcome(Map<Integer, List<String>> codesByField) implements OutcomeDeclaration {

    public CaseControlOutcome {
        if (codesByField == null || codesByField.isEmpty()) {
            throw new IllegalArgumentException("case_control needs at least one field");
        }
        Map<Integer, List<String>> copy = new LinkedHashMap<>();
        codesByField.forEach((field, codes) -> {
            if (codes == null || codes.isEmpty()) {
                throw new IllegalArgumentException("case_control field " + field + " lists no codes");
            }
            copy.put(field, List.copyOf(codes));
        });
        codesByField = java.util.Collections.unmodifiableMap(copy);
    }
}
