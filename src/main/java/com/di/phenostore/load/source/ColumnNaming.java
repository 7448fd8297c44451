package com.di.phenostore.load.source;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming rules for shard columns.
 * <p>
 * Source headers such as {@code 64-0.0} (field 64, instance 0, array index 0) become
 * {@code c64_0_0}; the subject id column {@code eid} keeps its name.
 */
public final class ColumnNaming {

    public static final String SUBJECT_ID = "eid";

    /** Any field column reference inside an expression. */
    public static final Pattern FIELD_NAME = Pattern.compile("(?i)c[0-9a-z_]+_[0-9]+_[0-9]+");

    private static final Pattern FIELD_INFO = Pattern.compile("c(?<fieldId>[0-9a-z_]+)_(?<instance>[0-9]+)_(?<array>[0-9]+)");

    private ColumnNaming() {}

    /** Shard column name for a source header. */
    public static String columnName(String header) {
        String trimmed = header.trim();
        if (trimmed.equals(SUBJECT_ID)) {
            return SUBJECT_ID;
        }
        return "c" + trimmed.replace('.', '_').replace('-', '_').toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a column name into field id, instance and array index.
     *
     * @return parsed info, or info holding only the name without its {@code c} prefix when
     *         the column does not follow the field naming scheme
     */
    public static FieldInfo fieldInfo(String columnName) {
        Matcher m = FIELD_INFO.matcher(columnName);
        if (m.matches()) {
            return new FieldInfo(m.group("fieldId"),
                    Integer.valueOf(m.group("instance")),
                    Integer.valueOf(m.group("array")));
        }
        String id = columnName.startsWith("c") ? columnName.substring(1) : columnName;
        return new FieldInfo(id, null, null);
    }

    public record FieldInfo(String fieldId, Integer instance, Integer array) {}
}
