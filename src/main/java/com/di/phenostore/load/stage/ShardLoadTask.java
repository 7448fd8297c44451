package com.di.phenostore.load.stage;

import com.di.phenostore.load.plan.ShardSpec;
import com.di.phenostore.registry.DataKind;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything one worker needs to load one shard. Each task owns its extract file and
 * its table exclusively.
 *
 * @param shard   the planned shard
 * @param kinds   storage kind of every shard column, aligned with {@code shard.getColumns()}
 * @param extract staging CSV holding {@code eid} plus the shard's columns
 */
public record ShardLoadTask(ShardSpec shard, List<DataKind> kinds, Path extract) {

    public String tableName() {
        return shard.getTableName();
    }
}
