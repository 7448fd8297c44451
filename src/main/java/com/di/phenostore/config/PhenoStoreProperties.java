package com.di.phenostore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration, bound from {@code phenostore.*} in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "phenostore")
public class PhenoStoreProperties {

    @Valid
    private Datasource datasource = new Datasource();

    @Valid
    private Load load = new Load();

    @Valid
    private Query query = new Query();

    @Data
    public static class Datasource {
        @NotBlank
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        @Positive
        private int maximumPoolSize = 10;
        @Min(0)
        private int minimumIdle = 1;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;

        public DbConfigSnapshot toSnapshot() {
            return new DbConfigSnapshot(jdbcUrl, username, password, driverClassName,
                    maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
        }
    }

    @Data
    public static class Load {
        /** Wide CSV sources, loaded in list order; the list index is the source index. */
        @Valid
        private List<Source> sources = new ArrayList<>();
        @NotBlank
        private String tablePrefix = "ukb_pheno_";
        /** Shard width: maximum number of data columns per shard table. */
        @Positive
        private int columnsPerTable = Integer.MAX_VALUE;
        /** Rows per batch when writing staging extracts. */
        @Positive
        private int chunkSize = 5_000;
        @Positive
        private int workers = Runtime.getRuntime().availableProcessors();
        private String tmpDir = System.getProperty("java.io.tmpdir");
        private boolean deleteStagingFiles = true;
        /** Optional .sample file giving the preferred subject order. */
        private String sampleOrderFile;
        /** Optional directory of data-coding TSV files (coding_&lt;N&gt;.tsv). */
        private String codingsDir;
        /** SQL files run after the sources are loaded, in list order. */
        private List<String> sqlFiles = new ArrayList<>();
        private boolean vacuum;
        private boolean runOnStartup;
    }

    @Data
    public static class Source {
        @NotBlank
        private String csv;
        /** Optional data dictionary CSV: column,type,description. */
        private String dictionary;
        private String encoding = "UTF-8";
    }

    @Data
    public static class Query {
        /** Rows per result chunk; unset means one unbounded chunk. */
        @Positive
        private Integer chunkSize;
        private String missingCode = "NA";
        private String orderTable = "bgen_samples";
    }
}
