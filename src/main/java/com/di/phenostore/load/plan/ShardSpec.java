package com.di.phenostore.load.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One planned shard: a consecutive slice of a source's columns and the table that holds it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardSpec {

    /** Position of the source in the load run. */
    private int sourceIndex;

    /** Zero-based position of this group within its source. */
    private int groupIndex;

    /** Physical table name, e.g. {@code ukb_pheno_0_00}. */
    private String tableName;

    /** Data columns of this shard in source order; the subject id column is implied. */
    private List<String> columns;
}
