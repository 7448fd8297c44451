package com.di.phenostore.query;

/**
 * How shard tables are combined.
 */
public enum JoinMode {
    /** Only subjects present in every involved shard. Used for plain field selection. */
    INNER,
    /**
     * Every subject present in at least one involved shard, missing values as nulls.
     * Used when assembling derived datasets.
     */
    OUTER
}
