package com.di.phenostore.query;

import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.util.InputValidator;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds the field names an expression refers to. Text inside quoted literals is ignored.
 */
public final class FieldReferences {

    private FieldReferences() {}

    public static Set<String> in(String expression) {
        Set<String> fields = new LinkedHashSet<>();
        Matcher m = ColumnNaming.FIELD_NAME.matcher(InputValidator.stripStringLiterals(expression));
        while (m.find()) {
            fields.add(m.group().toLowerCase(Locale.ROOT));
        }
        return fields;
    }

    public static Set<String> in(Collection<String> expressions) {
        Set<String> fields = new LinkedHashSet<>();
        for (String e : expressions) {
            fields.addAll(in(e));
        }
        return fields;
    }
}
