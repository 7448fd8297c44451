package com.di.phenostore.load.source;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declared value types and descriptions of a source's columns, read from a data
 * dictionary CSV with the header {@code column,type,description}.
 * <p>
 * Columns may be written either as in the source header ({@code 64-0.0}) or as shard
 * columns ({@code c64_0_0}). Columns absent from the dictionary are {@code Text}.
 */
@Slf4j
public class FieldDictionary {

    public static final String DEFAULT_TYPE = "Text";

    private static final Pattern CODING = Pattern.compile("Uses data-coding (?<coding>[0-9]+)");

    private final Map<String, Declaration> byColumn;

    private FieldDictionary(Map<String, Declaration> byColumn) {
        this.byColumn = byColumn;
    }

    public static FieldDictionary empty() {
        return new FieldDictionary(Map.of());
    }

    public static FieldDictionary load(Path path, Charset encoding) {
        if (path == null) {
            return empty();
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreHeaderCase(true)
                .build();

        Map<String, Declaration> byColumn = new HashMap<>();
        try (Reader reader = Files.newBufferedReader(path, encoding);
             CSVParser parser = format.parse(reader)) {
            if (!parser.getHeaderMap().containsKey("column") || !parser.getHeaderMap().containsKey("type")) {
                throw new IllegalArgumentException("Data dictionary " + path + " needs 'column' and 'type' headers");
            }
            boolean hasDescription = parser.getHeaderMap().containsKey("description");
            for (CSVRecord record : parser) {
                String column = record.get("column");
                if (column == null || column.isBlank()) {
                    continue;
                }
                String type = record.get("type");
                String description = hasDescription && record.isSet("description") ? record.get("description") : null;
                byColumn.put(normalize(column),
                        new Declaration(type == null || type.isBlank() ? DEFAULT_TYPE : type, description));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read data dictionary " + path, e);
        }
        log.info("[DICT] {} declaration(s) read from {}", byColumn.size(), path.getFileName());
        return new FieldDictionary(byColumn);
    }

    /** Declared value type of a shard column, {@code Text} when undeclared. */
    public String typeOf(String columnName) {
        Declaration d = byColumn.get(columnName);
        return d == null ? DEFAULT_TYPE : d.type();
    }

    public String descriptionOf(String columnName) {
        Declaration d = byColumn.get(columnName);
        return d == null ? null : d.description();
    }

    /** Data-coding number mentioned in the description, if any. */
    public Integer codingOf(String columnName) {
        String description = descriptionOf(columnName);
        if (description == null) {
            return null;
        }
        Matcher m = CODING.matcher(description);
        return m.find() ? Integer.valueOf(m.group("coding")) : null;
    }

    private static String normalize(String column) {
        String trimmed = column.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (ColumnNaming.FIELD_NAME.matcher(lower).matches() || lower.equals(ColumnNaming.SUBJECT_ID)) {
            return lower;
        }
        return ColumnNaming.columnName(trimmed);
    }

    private record Declaration(String type, String description) {}
}
