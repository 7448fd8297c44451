package com.di.phenostore.config;

import com.di.phenostore.exception.ErrorReport;
import com.di.phenostore.exception.ErrorTranslator;
import com.di.phenostore.load.WideTableLoadOrchestrator;
import com.di.phenostore.load.dto.LoadReport;
import com.di.phenostore.load.source.SourceDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the configured sources at startup when {@code phenostore.load.run-on-startup} is set.
 * A failed load is reported and logged; the application keeps serving what is loaded.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class LoadStartupRunner implements ApplicationRunner {

    private final PhenoStoreProperties properties;
    private final WideTableLoadOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        PhenoStoreProperties.Load load = properties.getLoad();
        if (!load.isRunOnStartup()) {
            log.info("[LOAD-STARTUP] run-on-startup is false; skipping load");
            return;
        }
        if (load.getSources().isEmpty()) {
            log.warn("[LOAD-STARTUP] run-on-startup is true but phenostore.load.sources is empty; nothing to load");
            return;
        }

        List<SourceDataset> sources = load.getSources().stream()
                .map(s -> new SourceDataset(Path.of(s.getCsv()),
                        s.getDictionary() == null ? null : Path.of(s.getDictionary()),
                        Charset.forName(s.getEncoding())))
                .toList();
        log.info("[LOAD-STARTUP] loading {} source(s)", sources.size());
        try {
            LoadReport report = orchestrator.load(sources);
            log.info("[LOAD-STARTUP] done: {} source(s), {} subject(s), {} event row(s) in {} ms",
                    report.getSources().size(), report.getAnchorSubjects(), report.getEventRows(), report.getDurationMs());
        } catch (RuntimeException e) {
            ErrorReport report = ErrorTranslator.toReport(e);
            log.error("[LOAD-STARTUP] load failed [{}]: {}{}", report.getErrorCategoryName(), report.getMessage(),
                    report.getOutput() == null ? "" : System.lineSeparator() + report.getOutput());
        }
    }
}
