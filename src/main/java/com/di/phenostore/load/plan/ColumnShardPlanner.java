package com.di.phenostore.load.plan;

import com.di.phenostore.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions the ordered columns of a wide source into consecutive groups of at most
 * {@code width} columns and names one table per group.
 *
 * <pre>
 *   columns  c1 c2 c3 c4 c5      width = 2
 *   groups   [c1 c2] [c3 c4] [c5]
 *   tables   prefix0_00  prefix0_01  prefix0_02
 * </pre>
 */
@Slf4j
public class ColumnShardPlanner {

    private final String tablePrefix;

    public ColumnShardPlanner(String tablePrefix) {
        this.tablePrefix = InputValidator.validateIdentifier(tablePrefix, "table prefix");
    }

    /**
     * @param sourceIndex position of the source in the load run
     * @param columns     data columns in source order, subject id excluded
     * @param width       maximum data columns per shard
     * @return {@code ceil(columns / width)} shards, in order
     */
    public List<ShardSpec> plan(int sourceIndex, List<String> columns, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Shard width must be positive, got " + width);
        }
        if (sourceIndex < 0) {
            throw new IllegalArgumentException("Source index must not be negative, got " + sourceIndex);
        }

        List<ShardSpec> shards = new ArrayList<>();
        for (int start = 0, group = 0; start < columns.size(); start += width, group++) {
            int end = (int) Math.min((long) start + width, columns.size());
            shards.add(ShardSpec.builder()
                    .sourceIndex(sourceIndex)
                    .groupIndex(group)
                    .tableName(tableName(sourceIndex, group))
                    .columns(List.copyOf(columns.subList(start, end)))
                    .build());
        }
        log.info("[PLAN] source={} columns={} width={} -> {} shard(s)",
                sourceIndex, columns.size(), width == Integer.MAX_VALUE ? "unbounded" : width, shards.size());
        return shards;
    }

    public String tableName(int sourceIndex, int groupIndex) {
        return tablePrefix + sourceIndex + "_" + String.format("%02d", groupIndex);
    }
}
