package com.di.phenostore.load.source;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * A wide source file to load.
 *
 * @param csv        comma-separated file with a header row; one column must be {@code eid}
 * @param dictionary optional data dictionary ({@code column,type,description}), may be {@code null}
 * @param encoding   character set of both files
 */
public record SourceDataset(Path csv, Path dictionary, Charset encoding) {

    public SourceDataset {
        if (csv == null) {
            throw new IllegalArgumentException("Source csv path is required");
        }
        if (encoding == null) {
            encoding = StandardCharsets.UTF_8;
        }
    }

    public static SourceDataset of(Path csv, Path dictionary) {
        return new SourceDataset(csv, dictionary, StandardCharsets.UTF_8);
    }

    public String name() {
        return csv.getFileName().toString();
    }
}
