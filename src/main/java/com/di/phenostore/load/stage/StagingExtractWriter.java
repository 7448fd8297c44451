package com.di.phenostore.load.stage;

import com.di.phenostore.load.plan.ShardSpec;
import com.di.phenostore.load.source.SourceDataset;
import com.di.phenostore.load.source.WideCsvReader;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Streams a wide source once and fans every record out to one staging CSV per shard
 * (subject id plus the shard's columns), in batches of {@code chunkSize} rows.
 * <p>
 * Missing values ({@code ""}, {@code NA}, {@code nan}, {@code NaN}) are written as empty
 * unquoted fields, which every importer reads as NULL.
 */
@Slf4j
public class StagingExtractWriter {

    static final Set<String> MISSING_TOKENS = Set.of("", "NA", "nan", "NaN");

    private final int chunkSize;

    public StagingExtractWriter(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Writes the extract of a single shard.
     *
     * @return number of data rows written
     */
    public long write(SourceDataset source, ShardSpec shard, Path target) throws IOException {
        return write(source, List.of(new ShardLoadTask(shard, List.of(), target)));
    }

    /**
     * Writes the extract of every task in one pass over the source. All extracts hold the
     * same subjects in the same order.
     *
     * @return number of data rows written to each extract
     */
    public long write(SourceDataset source, List<ShardLoadTask> tasks) throws IOException {
        if (tasks.isEmpty()) {
            return 0;
        }
        List<Extract> extracts = new ArrayList<>(tasks.size());
        long rows = 0;
        long skipped = 0;
        try (WideCsvReader reader = new WideCsvReader(source)) {
            List<String> sourceColumns = reader.columnNames();
            int subjectIndex = reader.subjectIdIndex();
            for (ShardLoadTask task : tasks) {
                extracts.add(Extract.open(task, projection(sourceColumns, task.shard()),
                        sourceColumns.get(subjectIndex), Math.min(chunkSize, 10_000)));
            }

            int pending = 0;
            for (CSVRecord record : reader) {
                String subjectId = valueAt(record, subjectIndex);
                if (subjectId == null) {
                    skipped++;
                    continue;
                }
                for (Extract extract : extracts) {
                    extract.add(subjectId, record);
                }
                if (++pending >= chunkSize) {
                    for (Extract extract : extracts) {
                        extract.flush();
                    }
                    rows += pending;
                    pending = 0;
                }
            }
            for (Extract extract : extracts) {
                extract.flush();
            }
            rows += pending;
        } finally {
            closeAll(extracts);
        }
        if (skipped > 0) {
            log.warn("[STAGE] {} skipped {} row(s) without subject id", source.name(), skipped);
        }
        log.info("[STAGE] {} -> {} extract(s), {} rows each", source.name(), extracts.size(), rows);
        return rows;
    }

    /** Source positions of the shard's columns. */
    private static int[] projection(List<String> sourceColumns, ShardSpec shard) {
        int[] indexes = new int[shard.getColumns().size()];
        for (int i = 0; i < indexes.length; i++) {
            int idx = sourceColumns.indexOf(shard.getColumns().get(i));
            if (idx < 0) {
                throw new IllegalStateException("Column " + shard.getColumns().get(i) + " not in source");
            }
            indexes[i] = idx;
        }
        return indexes;
    }

    private static String valueAt(CSVRecord record, int index) {
        if (index >= record.size()) {
            return null;
        }
        String v = record.get(index);
        return MISSING_TOKENS.contains(v.trim()) ? null : v;
    }

    private static void closeAll(List<Extract> extracts) throws IOException {
        IOException failure = null;
        for (Extract extract : extracts) {
            try {
                extract.printer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /** One open shard extract with its pending batch. */
    private static final class Extract {
        private final int[] indexes;
        private final CSVPrinter printer;
        private final List<List<String>> batch;

        private Extract(int[] indexes, CSVPrinter printer, int capacity) {
            this.indexes = indexes;
            this.printer = printer;
            this.batch = new ArrayList<>(capacity);
        }

        static Extract open(ShardLoadTask task, int[] indexes, String subjectColumn, int capacity) throws IOException {
            CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(task.extract(), StandardCharsets.UTF_8),
                    CSVFormat.DEFAULT);
            List<String> header = new ArrayList<>(indexes.length + 1);
            header.add(subjectColumn);
            header.addAll(task.shard().getColumns());
            try {
                printer.printRecord(header);
            } catch (IOException e) {
                printer.close();
                throw e;
            }
            return new Extract(indexes, printer, capacity);
        }

        void add(String subjectId, CSVRecord record) {
            List<String> row = new ArrayList<>(indexes.length + 1);
            row.add(subjectId);
            for (int index : indexes) {
                row.add(valueAt(record, index));
            }
            batch.add(row);
        }

        void flush() throws IOException {
            // nulls print as empty unquoted fields
            printer.printRecords(batch);
            printer.flush();
            batch.clear();
        }
    }
}
