package com.di.phenostore.config;

import com.di.phenostore.cohort.CohortResolver;
import com.di.phenostore.load.WideTableLoadOrchestrator;
import com.di.phenostore.query.PhenotypeQueryService;
import com.di.phenostore.query.QueryCompiler;
import com.di.phenostore.query.document.QueryDocumentParser;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.BackendDialect;
import com.di.phenostore.sql.SqlRenderer;
import com.di.phenostore.stream.ResultStreamer;
import com.di.phenostore.util.InputValidator;
import com.di.phenostore.util.PooledDataSources;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Wires the store's components around one pooled {@link DataSource}.
 *
 * <p>The pool comes from {@link PooledDataSources} rather than Spring's DataSource
 * auto-configuration, so loader and query side share the same Hikari pool for a given
 * URL and user. Components take their settings at construction; nothing reads global state.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DataSourceConfig {

    private final PhenoStoreProperties properties;

    @Bean(destroyMethod = "")
    public DataSource phenoDataSource() {
        DbConfigSnapshot snapshot = properties.getDatasource().toSnapshot();
        log.info("[CONFIG] datasource {}", InputValidator.sanitizeForLogging(snapshot.jdbcUrl()));
        return PooledDataSources.INSTANCE.getOrInit(snapshot);
    }

    @PreDestroy
    public void closePools() {
        PooledDataSources.INSTANCE.closeAll();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public BackendDialect backendDialect(DataSource dataSource) {
        return BackendDialect.detect(dataSource);
    }

    @Bean
    public FieldRegistry fieldRegistry(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                       BackendDialect dialect) {
        return new FieldRegistry(jdbcTemplate, transactionTemplate, dialect);
    }

    @Bean
    public LoadSettings loadSettings() {
        return LoadSettings.from(properties.getLoad());
    }

    @Bean
    public QuerySettings querySettings() {
        return QuerySettings.from(properties.getQuery());
    }

    @Bean
    public WideTableLoadOrchestrator wideTableLoadOrchestrator(JdbcTemplate jdbcTemplate, FieldRegistry registry,
                                                               BackendDialect dialect, LoadSettings loadSettings) {
        return new WideTableLoadOrchestrator(jdbcTemplate, registry, dialect, loadSettings);
    }

    @Bean
    public QueryCompiler queryCompiler(FieldRegistry registry) {
        return new QueryCompiler(registry);
    }

    @Bean
    public CohortResolver cohortResolver(FieldRegistry registry, QueryCompiler compiler) {
        return new CohortResolver(registry, compiler);
    }

    @Bean
    public ResultStreamer resultStreamer(DataSource dataSource, BackendDialect dialect, QuerySettings querySettings) {
        return new ResultStreamer(dataSource, new SqlRenderer(dialect), querySettings);
    }

    @Bean
    public PhenotypeQueryService phenotypeQueryService(FieldRegistry registry, QueryCompiler compiler,
                                                       CohortResolver cohortResolver, ResultStreamer streamer,
                                                       QuerySettings querySettings) {
        return new PhenotypeQueryService(registry, compiler, cohortResolver, new QueryDocumentParser(),
                streamer, querySettings);
    }
}
