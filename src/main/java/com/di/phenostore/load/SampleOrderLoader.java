package com.di.phenostore.load;

import com.di.phenostore.load.source.ColumnNaming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a genotype {@code .sample} file into the preferred-order table
 * {@code bgen_samples(sample_index, eid)}.
 * <p>
 * The file has two header lines (column names, then column types); every following
 * line starts with the subject id, whitespace-separated. {@code sample_index} is the
 * 1-based position of the line.
 */
@Slf4j
@RequiredArgsConstructor
public class SampleOrderLoader {

    public static final String TABLE = "bgen_samples";

    private final JdbcTemplate jdbc;

    public int load(Path sampleFile) {
        List<Object[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(sampleFile, StandardCharsets.UTF_8)) {
            reader.readLine();
            reader.readLine();
            String line;
            int index = 0;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String subjectId = trimmed.split("\\s+")[0];
                rows.add(new Object[]{++index, Long.parseLong(subjectId)});
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read sample file " + sampleFile, e);
        }

        jdbc.execute("DROP TABLE IF EXISTS " + TABLE);
        jdbc.execute("CREATE TABLE " + TABLE + " (sample_index INTEGER NOT NULL PRIMARY KEY, "
                + ColumnNaming.SUBJECT_ID + " BIGINT NOT NULL)");
        if (!rows.isEmpty()) {
            jdbc.batchUpdate("INSERT INTO " + TABLE + " (sample_index, " + ColumnNaming.SUBJECT_ID + ") VALUES (?, ?)", rows);
        }
        log.info("[DERIVED] {} loaded from {}: {} samples", TABLE, sampleFile.getFileName(), rows.size());
        return rows.size();
    }
}
