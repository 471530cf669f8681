package com.sparkify.etl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.catalyst.util.BadRecordException;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * Loads newline-delimited JSON records into schema-typed datasets.
 * A location may be a glob; all matched files are read as one table.
 */
public class IngestionReader {

    private static final Logger logger = LoggerFactory.getLogger(IngestionReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SparkSession spark;

    public IngestionReader(SparkSession spark) {
        this.spark = spark;
    }

    public Dataset<Row> readSongs(String sourceLocation) {
        return read(RecordType.SONG, sourceLocation);
    }

    public Dataset<Row> readLogs(String sourceLocation) {
        return read(RecordType.LOG, sourceLocation);
    }

    /**
     * Reads and validates one record type. Fails fast on the first malformed record;
     * there is no skip-bad-records mode.
     */
    public Dataset<Row> read(RecordType type, String sourceLocation) {
        logger.info("Reading {} records from {}", type.tag(), sourceLocation);

        Dataset<Row> df;
        try {
            df = spark.read()
                .schema(SchemaRegistry.structType(type))
                .option("mode", "FAILFAST")
                .json(sourceLocation);
        } catch (Exception e) {
            throw new EtlException("Cannot read " + type.tag() + " records from " + sourceLocation
                + ": " + e.getMessage(), e);
        }

        // Reused by several builders
        df.cache();
        try {
            validate(type, df);
            validateStringTokens(type, sourceLocation);
        } catch (RuntimeException e) {
            df.unpersist();
            throw e;
        }
        return df;
    }

    /**
     * Counts nulls in every column in a single pass. Touching every column forces the
     * JSON parser to convert each field, so type mismatches surface here as well.
     */
    private void validate(RecordType type, Dataset<Row> df) {
        List<ColumnSpec> columns = SchemaRegistry.columns(type);
        Column[] nullCounts = new Column[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).name();
            nullCounts[i] = sum(when(col(name).isNull(), 1).otherwise(0)).alias(name);
        }

        Row profile;
        try {
            profile = df.agg(count(lit(1)).alias("_rows"), nullCounts).first();
        } catch (Exception e) {
            throw readFailure(type, e);
        }

        long rows = profile.getLong(0);
        for (ColumnSpec column : columns) {
            if (column.isNullable() || rows == 0) {
                continue;
            }
            long missing = profile.getAs(column.name());
            if (missing > 0) {
                throw new SchemaViolationException(type, column.name(),
                    missing + " " + type.tag() + " record(s) missing required column '" + column.name() + "'");
            }
        }
        logger.info("Validated {} {} records", rows, type.tag());
    }

    /**
     * Spark stores any JSON value read into a string column as its raw text. Numbers are
     * accepted that way (coordinates arrive as numbers), but objects, arrays and booleans
     * in a string column are rejected. Checked on the raw lines, where the token type is
     * still visible.
     */
    private void validateStringTokens(RecordType type, String sourceLocation) {
        String[] stringColumns = SchemaRegistry.columns(type).stream()
            .filter(column -> column.type() == SemanticType.STRING)
            .map(ColumnSpec::name)
            .toArray(String[]::new);

        UserDefinedFunction nonTextField = udf(
            (UDF1<String, String>) line -> firstNonTextField(line, stringColumns),
            DataTypes.StringType
        );

        List<Row> offending;
        try {
            offending = spark.read()
                .text(sourceLocation)
                .select(nonTextField.apply(col("value")).alias("column"), col("value"))
                .filter(col("column").isNotNull())
                .limit(1)
                .collectAsList();
        } catch (Exception e) {
            throw readFailure(type, e);
        }
        if (offending.isEmpty()) {
            return;
        }

        String column = offending.get(0).getString(0);
        throw new SchemaViolationException(type, column, type.tag() + " record has a non-string value in column '"
            + column + "': " + offending.get(0).getString(1));
    }

    /**
     * @return the first of the given fields holding an object, array or boolean, or null
     */
    static String firstNonTextField(String line, String[] stringColumns) {
        if (line == null || line.trim().isEmpty()) {
            return null;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            // unparseable lines are reported by the FAILFAST pass
            return null;
        }
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            for (JsonNode record : root) {
                String column = nonTextField(record, stringColumns);
                if (column != null) {
                    return column;
                }
            }
            return null;
        }
        return nonTextField(root, stringColumns);
    }

    private static String nonTextField(JsonNode record, String[] stringColumns) {
        if (!record.isObject()) {
            return null;
        }
        for (String column : stringColumns) {
            JsonNode value = record.get(column);
            if (value != null && (value.isContainerNode() || value.isBoolean())) {
                return column;
            }
        }
        return null;
    }

    /**
     * Spark's FAILFAST parse errors become schema violations; storage and engine failures
     * (missing files, permissions, lost executors) stay plain read failures.
     */
    private static EtlException readFailure(RecordType type, Exception e) {
        if (isMalformedRecord(e)) {
            return new SchemaViolationException(type, "Malformed " + type.tag() + " record: " + rootMessage(e), e);
        }
        return new EtlException("Failed to read " + type.tag() + " records: " + rootMessage(e), e);
    }

    static boolean isMalformedRecord(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof BadRecordException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && (message.contains("MALFORMED_RECORD_IN_PARSING")
                || message.contains("Malformed records are detected"))) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
