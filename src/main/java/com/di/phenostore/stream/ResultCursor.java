package com.di.phenostore.stream;

import com.di.phenostore.exception.ErrorTranslator;
import com.di.phenostore.query.OutputColumn;
import com.di.phenostore.sql.RenderedQuery;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, forward-only sequence of {@link ResultChunk}s over one open database cursor.
 *
 * <p>The cursor owns a pooled connection with auto-commit off, which lets PostgreSQL
 * stream rows from a server-side cursor in batches of the fetch size. The connection is
 * returned to the pool when the rows are exhausted, when {@link #close()} is called, or
 * when reading fails. A failure surfaces as a translated exception and ends the sequence.
 */
@Slf4j
public class ResultCursor implements Iterator<ResultChunk>, AutoCloseable {

    private final List<OutputColumn> columns;
    private final List<String> labels;
    private final Integer chunkSize;

    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;

    /** Whether {@link #resultSet} is positioned on an unread row. */
    private boolean rowPending;
    private boolean unboundedChunkServed;
    private boolean closed;
    private long rowsRead;

    private ResultCursor(List<OutputColumn> columns, Integer chunkSize) {
        this.columns = List.copyOf(columns);
        this.labels = columns.stream().map(OutputColumn::label).toList();
        this.chunkSize = chunkSize;
    }

    /**
     * Executes the query and positions the cursor before the first row.
     *
     * @param chunkSize rows per chunk and fetch size, or {@code null} for a single chunk
     */
    static ResultCursor open(DataSource dataSource, RenderedQuery query, List<OutputColumn> columns, Integer chunkSize) {
        ResultCursor cursor = new ResultCursor(columns, chunkSize);
        try {
            cursor.connection = dataSource.getConnection();
            cursor.connection.setAutoCommit(false);
            cursor.statement = cursor.connection.prepareStatement(query.sql(),
                    ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            if (chunkSize != null) {
                cursor.statement.setFetchSize(chunkSize);
            }
            List<Object> params = query.parameters();
            for (int i = 0; i < params.size(); i++) {
                cursor.statement.setObject(i + 1, params.get(i));
            }
            cursor.resultSet = cursor.statement.executeQuery();
            cursor.rowPending = cursor.resultSet.next();
        } catch (SQLException | RuntimeException e) {
            cursor.close();
            throw ErrorTranslator.translate(e);
        }
        return cursor;
    }

    public List<String> columns() {
        return labels;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (chunkSize == null && !unboundedChunkServed) {
            return true;
        }
        if (!rowPending) {
            close();
        }
        return rowPending;
    }

    @Override
    public ResultChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Result cursor exhausted");
        }
        int limit = chunkSize != null ? chunkSize : Integer.MAX_VALUE;
        List<ResultRow> rows = new ArrayList<>(Math.min(limit, 1024));
        try {
            while (rowPending && rows.size() < limit) {
                rows.add(readRow());
                rowPending = resultSet.next();
            }
        } catch (SQLException | RuntimeException e) {
            log.warn("[STREAM] read failed after {} row(s), closing cursor", rowsRead);
            close();
            throw ErrorTranslator.translate(e);
        }
        unboundedChunkServed = true;
        rowsRead += rows.size();
        if (!rowPending) {
            close();
        }
        return new ResultChunk(labels, rows);
    }

    public Stream<ResultChunk> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    public boolean isClosed() {
        return closed;
    }

    /** Abandons the remaining rows and releases the connection. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        rowPending = false;
        closeQuietly(resultSet);
        closeQuietly(statement);
        if (connection != null) {
            try {
                connection.rollback();
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("[STREAM] could not reset connection: {}", e.getMessage());
            }
            closeQuietly(connection);
        }
        log.debug("[STREAM] cursor closed after {} row(s)", rowsRead);
    }

    private ResultRow readRow() throws SQLException {
        long subjectId = resultSet.getLong(1);
        List<Object> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Object value = resultSet.getObject(i + 2);
            values.add(columns.get(i).isInteger() ? IntegerValueFormatter.format(value) : value);
        }
        return new ResultRow(subjectId, values);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("[STREAM] close failed: {}", e.getMessage());
        }
    }
}
