package com.sparkify.etl;

import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;

/**
 * Column types understood by the schema registry, with their Spark storage type.
 */
public enum SemanticType {
    STRING(DataTypes.StringType),
    INTEGER(DataTypes.IntegerType),
    LONG(DataTypes.LongType),
    DOUBLE(DataTypes.DoubleType),
    // epoch milliseconds, converted to a timestamp by the builders
    TIMESTAMP_MILLIS(DataTypes.LongType);

    private final DataType sparkType;

    SemanticType(DataType sparkType) {
        this.sparkType = sparkType;
    }

    public DataType sparkType() {
        return sparkType;
    }
}
