package com.di.phenostore.load;

import com.di.phenostore.sql.BackendDialect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads data-coding files into {@code codings(data_coding, coding, meaning, node_id,
 * parent_id, selectable)}.
 * <p>
 * Every {@code *_<N>.tsv} file of the directory holds the codes of data-coding {@code N}:
 * a tab-separated header with {@code coding} and {@code meaning}, and for hierarchical
 * codings {@code node_id}, {@code parent_id} and {@code selectable} ({@code Y}/{@code N}).
 * The table is rebuilt on every call.
 */
@Slf4j
@RequiredArgsConstructor
public class CodingsLoader {

    public static final String TABLE = "codings";

    private static final Pattern FILE_NAME = Pattern.compile("[^_]+_([0-9]+)\\.tsv");
    private static final List<String> INDEXED = List.of("data_coding", "coding", "node_id", "parent_id", "selectable");

    private static final CSVFormat FORMAT = CSVFormat.TDF.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setQuote(null)
            .setTrim(true)
            .setIgnoreHeaderCase(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final JdbcTemplate jdbc;
    private final BackendDialect dialect;

    /**
     * @return number of coding rows loaded
     */
    public int load(Path codingsDir) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(codingsDir)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".tsv")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list codings directory " + codingsDir, e);
        }

        List<Object[]> rows = new ArrayList<>();
        int codings = 0;
        for (Path file : files) {
            Matcher m = FILE_NAME.matcher(file.getFileName().toString());
            if (!m.matches()) {
                log.warn("[CODINGS] {} does not name a data-coding (expected coding_<N>.tsv), skipped", file.getFileName());
                continue;
            }
            rows.addAll(read(file, Integer.parseInt(m.group(1))));
            codings++;
        }

        String text = dialect.textType();
        jdbc.execute("DROP TABLE IF EXISTS " + TABLE);
        jdbc.execute("CREATE TABLE " + TABLE + " ("
                + "data_coding BIGINT NOT NULL, "
                + "coding " + text + " NOT NULL, "
                + "meaning " + text + " NOT NULL, "
                + "node_id BIGINT NULL, "
                + "parent_id BIGINT NULL, "
                + "selectable BOOLEAN NULL, "
                + "PRIMARY KEY (data_coding, coding, meaning))");
        if (!rows.isEmpty()) {
            jdbc.batchUpdate("INSERT INTO " + TABLE
                    + " (data_coding, coding, meaning, node_id, parent_id, selectable) VALUES (?, ?, ?, ?, ?, ?)", rows);
        }
        for (String column : INDEXED) {
            jdbc.execute("CREATE INDEX IF NOT EXISTS ix_" + TABLE + "_" + column + " ON " + TABLE + " (" + column + ")");
        }
        log.info("[CODINGS] {} loaded from {}: {} coding(s), {} row(s)", TABLE, codingsDir, codings, rows.size());
        return rows.size();
    }

    private static List<Object[]> read(Path file, int dataCoding) {
        List<Object[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (!header.containsKey("coding") || !header.containsKey("meaning")) {
                throw new IllegalArgumentException("Codings file " + file.getFileName()
                        + " needs 'coding' and 'meaning' columns, has " + header.keySet());
            }
            for (CSVRecord record : parser) {
                String coding = value(record, "coding");
                if (coding == null) {
                    continue;
                }
                String meaning = value(record, "meaning");
                rows.add(new Object[]{
                        dataCoding,
                        coding,
                        meaning == null ? "" : meaning,
                        longValue(record, "node_id", file),
                        longValue(record, "parent_id", file),
                        selectable(value(record, "selectable"))});
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read codings file " + file, e);
        }
        log.debug("[CODINGS] {} -> data-coding {}: {} row(s)", file.getFileName(), dataCoding, rows.size());
        return rows;
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return null;
        }
        String v = record.get(column);
        return v.isEmpty() ? null : v;
    }

    private static Long longValue(CSVRecord record, String column, Path file) {
        String v = value(record, column);
        if (v == null) {
            return null;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Codings file " + file.getFileName() + " line "
                    + record.getRecordNumber() + ": " + column + " '" + v + "' is not an integer", e);
        }
    }

    private static Boolean selectable(String v) {
        if (v == null) {
            return null;
        }
        return switch (v.toUpperCase(Locale.ROOT)) {
            case "Y", "YES", "TRUE", "T", "1" -> Boolean.TRUE;
            case "N", "NO", "FALSE", "F", "0" -> Boolean.FALSE;
            default -> null;
        };
    }
}
