package com.di.phenostore.load;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs user SQL files against the store, statement by statement, e.g. to add tables of
 * derived subject data. A failing statement stops the file.
 */
@Slf4j
@RequiredArgsConstructor
public class SqlScriptLoader {

    private final DataSource dataSource;

    public void run(Path script) {
        if (!Files.isReadable(script)) {
            throw new IllegalArgumentException("SQL file " + script + " is not readable");
        }
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new FileSystemResource(script));
        populator.setSqlScriptEncoding("UTF-8");
        populator.setContinueOnError(false);
        long startMs = System.currentTimeMillis();
        populator.execute(dataSource);
        log.info("[SQL] {} executed in {}ms", script.getFileName(), System.currentTimeMillis() - startMs);
    }
}
