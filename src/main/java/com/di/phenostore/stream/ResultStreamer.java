package com.di.phenostore.stream;

import com.di.phenostore.config.QuerySettings;
import com.di.phenostore.query.CompiledQuery;
import com.di.phenostore.sql.RenderedQuery;
import com.di.phenostore.sql.SqlRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Renders compiled queries and opens a {@link ResultCursor} per request.
 */
@Slf4j
@RequiredArgsConstructor
public class ResultStreamer {

    private final DataSource dataSource;
    private final SqlRenderer renderer;
    private final QuerySettings settings;

    public ResultCursor open(CompiledQuery compiled) {
        RenderedQuery rendered = renderer.render(compiled.query());
        if (settings.chunkSize() == null) {
            log.warn("[STREAM] no chunk size configured; the whole result is read as one chunk");
        }
        log.debug("[STREAM] {} {}", rendered.sql(), rendered.parameters());
        return ResultCursor.open(dataSource, rendered, compiled.columns(), settings.chunkSize());
    }
}
