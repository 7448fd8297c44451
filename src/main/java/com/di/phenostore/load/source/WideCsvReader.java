package com.di.phenostore.load.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Streaming reader over a wide source CSV. Header names are exposed already renamed to
 * shard column names; records are read one at a time.
 */
public class WideCsvReader implements Closeable, Iterable<CSVRecord> {

    private final Reader reader;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> columnNames;
    private final int subjectIdIndex;

    public WideCsvReader(SourceDataset source) throws IOException {
        this.reader = Files.newBufferedReader(source.csv(), source.encoding());
        try {
            this.parser = CSVFormat.DEFAULT.parse(reader);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
        this.records = parser.iterator();
        if (!records.hasNext()) {
            close();
            throw new IllegalArgumentException("Source " + source.name() + " is empty");
        }
        List<String> names = new ArrayList<>();
        for (String header : records.next()) {
            names.add(ColumnNaming.columnName(header));
        }
        this.columnNames = List.copyOf(names);
        this.subjectIdIndex = columnNames.indexOf(ColumnNaming.SUBJECT_ID);
        if (subjectIdIndex < 0) {
            close();
            throw new IllegalArgumentException("Source " + source.name() + " has no '" + ColumnNaming.SUBJECT_ID + "' column");
        }
    }

    /** Shard column names of every source column, in file order, subject id included. */
    public List<String> columnNames() {
        return columnNames;
    }

    public int subjectIdIndex() {
        return subjectIdIndex;
    }

    /** Data records after the header; single pass. */
    @Override
    public Iterator<CSVRecord> iterator() {
        return records;
    }

    @Override
    public void close() throws IOException {
        try {
            parser.close();
        } finally {
            reader.close();
        }
    }
}
