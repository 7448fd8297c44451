package com.di.phenostore.query;

import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.util.InputValidator;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A requested output column: an expression with an optional alias.
 * <p>
 * Accepted forms: {@code c21_0_0}, {@code (c21_0_0)}, {@code c21_0_0 age},
 * {@code c21_0_0 as age}, {@code c47_0_0 * 2 as doubled}. A bare alias without
 * {@code as} is only recognised after a single field.
 *
 * @param expression the expression as written, alias removed
 * @param alias      output name, or {@code null}
 * @param field      the field name when the expression is a single field, otherwise {@code null}
 */
public record ColumnSpec(String expression, String alias, String field) {

    private static final Pattern WITH_AS = Pattern.compile("(?is)^(.*\\S)\\s+as\\s+([A-Za-z_][A-Za-z0-9_]*)$");

    private static final Pattern FIELD_WITH_RENAME = Pattern.compile(
            "(?i)^\\(?\\s*(" + ColumnNaming.FIELD_NAME.pattern().replace("(?i)", "") + ")\\s*\\)?(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?$");

    public static ColumnSpec parse(String raw) {
        String text = InputValidator.validateExpression(raw, "column expression");

        Matcher fieldOnly = FIELD_WITH_RENAME.matcher(text);
        if (fieldOnly.matches()) {
            String alias = fieldOnly.group(2);
            return new ColumnSpec(fieldOnly.group(1), alias == null ? null : validAlias(alias),
                    fieldOnly.group(1).toLowerCase(Locale.ROOT));
        }

        Matcher withAs = WITH_AS.matcher(text);
        if (withAs.matches()) {
            String expression = withAs.group(1).trim();
            String alias = validAlias(withAs.group(2));
            Matcher inner = FIELD_WITH_RENAME.matcher(expression);
            if (inner.matches() && inner.group(2) == null) {
                return new ColumnSpec(expression, alias, inner.group(1).toLowerCase(Locale.ROOT));
            }
            return new ColumnSpec(expression, alias, null);
        }
        return new ColumnSpec(text, null, null);
    }

    public boolean isField() {
        return field != null;
    }

    /** Name shown to consumers: the alias, else the field, else the expression text. */
    public String label() {
        if (alias != null) {
            return alias;
        }
        return field != null ? field : expression;
    }

    private static String validAlias(String alias) {
        return InputValidator.validateIdentifier(alias, "column alias").toLowerCase(Locale.ROOT);
    }
}
