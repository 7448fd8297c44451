package com.di.phenostore.registry;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the field registry: where a logical field lives and what it holds.
 */
@Value
@Builder(toBuilder = true)
public class FieldEntry {

    public static final String CATEGORICAL_MULTIPLE = "Categorical (multiple)";

    /** Column name in the shard table, e.g. {@code c21_0_0}. */
    String fieldName;
    String tableName;
    String fieldId;
    Integer instance;
    Integer array;
    Integer coding;
    /** Declared value type as written in the data dictionary. */
    String valueType;
    String description;

    public DataKind getKind() {
        return DataKind.fromDeclaredType(valueType);
    }
}
