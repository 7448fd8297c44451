package com.di.phenostore.cohort;

import java.util.List;

/**
 * Integer-coded outcome from predicates. A subject gets the value of the last declared
 * category whose predicate it satisfies; subjects satisfying none are absent.
 */
public record CategoryOutcome(List<Category> categories) implements OutcomeDeclaration {

    public CategoryOutcome {
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("sql needs at least one category");
        }
        categories = List.copyOf(categories);
        if (categories.stream().map(Category::value).distinct().count() != categories.size()) {
            throw new IllegalArgumentException("category values must be distinct");
        }
    }

    public record Category(long value, String predicate) {}
}
