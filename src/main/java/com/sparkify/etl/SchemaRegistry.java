package com.sparkify.etl;

import org.apache.spark.sql.types.StructType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.sparkify.etl.ColumnSpec.optional;
import static com.sparkify.etl.ColumnSpec.required;

/**
 * Fixed column definitions for the raw song and log records.
 * Column order matches the order of the source JSON documents.
 */
public final class SchemaRegistry {

    private static final List<ColumnSpec> SONG_COLUMNS = Collections.unmodifiableList(Arrays.asList(
        required("artist_id", SemanticType.STRING),
        optional("artist_latitude", SemanticType.STRING),
        optional("artist_longitude", SemanticType.STRING),
        optional("artist_location", SemanticType.STRING),
        required("artist_name", SemanticType.STRING),
        required("song_id", SemanticType.STRING),
        required("title", SemanticType.STRING),
        optional("duration", SemanticType.DOUBLE),
        optional("year", SemanticType.INTEGER)
    ));

    private static final List<ColumnSpec> LOG_COLUMNS = Collections.unmodifiableList(Arrays.asList(
        required("artist", SemanticType.STRING),
        optional("auth", SemanticType.STRING),
        optional("firstName", SemanticType.STRING),
        optional("gender", SemanticType.STRING),
        optional("itemInSession", SemanticType.LONG),
        optional("lastName", SemanticType.STRING),
        optional("length", SemanticType.DOUBLE),
        optional("level", SemanticType.STRING),
        optional("location", SemanticType.STRING),
        optional("method", SemanticType.STRING),
        required("page", SemanticType.STRING),
        optional("registration", SemanticType.DOUBLE),
        optional("sessionId", SemanticType.LONG),
        required("song", SemanticType.STRING),
        optional("status", SemanticType.LONG),
        required("ts", SemanticType.TIMESTAMP_MILLIS),
        optional("userAgent", SemanticType.STRING),
        required("userId", SemanticType.STRING)
    ));

    private SchemaRegistry() {
    }

    public static List<ColumnSpec> columns(RecordType type) {
        switch (type) {
            case SONG:
                return SONG_COLUMNS;
            case LOG:
                return LOG_COLUMNS;
            default:
                throw new IllegalArgumentException("Unsupported record type: " + type);
        }
    }

    public static List<ColumnSpec> columns(String tag) {
        return columns(RecordType.fromTag(tag));
    }

    public static List<String> requiredColumns(RecordType type) {
        return columns(type).stream()
            .filter(column -> !column.isNullable())
            .map(ColumnSpec::name)
            .collect(Collectors.toList());
    }

    /**
     * Spark schema used when reading the raw JSON. Nullability is declared here but
     * Spark's JSON source does not enforce it, so readers check required columns themselves.
     */
    public static StructType structType(RecordType type) {
        StructType schema = new StructType();
        for (ColumnSpec column : columns(type)) {
            schema = schema.add(column.name(), column.type().sparkType(), column.isNullable());
        }
        return schema;
    }
}
