package com.di.phenostore.config;

/**
 * Query-side settings.
 *
 * @param chunkSize   rows per result chunk, or {@code null} for one unbounded chunk
 * @param missingCode default missing-value sentinel handed to serializers
 * @param orderTable  table holding the preferred subject order
 */
public record QuerySettings(Integer chunkSize, String missingCode, String orderTable) {

    public static QuerySettings defaults() {
        return new QuerySettings(null, "NA", "bgen_samples");
    }

    public static QuerySettings from(PhenoStoreProperties.Query query) {
        return new QuerySettings(query.getChunkSize(), query.getMissingCode(), query.getOrderTable());
    }
}
