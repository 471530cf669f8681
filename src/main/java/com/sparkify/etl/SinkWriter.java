package com.sparkify.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Persists tables as Parquet, replacing whatever was at the destination.
 */
public class SinkWriter {

    private static final Logger logger = LoggerFactory.getLogger(SinkWriter.class);

    public void write(OutputTable table, Dataset<Row> data, String outputRoot) {
        write(table.directory(), data, table.destination(outputRoot), table.partitionColumns());
    }

    public void writeTable(Dataset<Row> table, String destinationPath, String... partitionColumns) {
        writeTable(table, destinationPath, Arrays.asList(partitionColumns));
    }

    /**
     * Writes with full-overwrite semantics. With partition columns, rows land in
     * column=value directories; static overwrite mode removes partitions absent from
     * this run as well.
     */
    public void writeTable(Dataset<Row> table, String destinationPath, List<String> partitionColumns) {
        write(tableName(destinationPath), table, destinationPath, partitionColumns);
    }

    private void write(String tableName, Dataset<Row> table, String destinationPath, List<String> partitionColumns) {
        List<String> columns = Arrays.asList(table.columns());
        for (String partitionColumn : partitionColumns) {
            if (!columns.contains(partitionColumn)) {
                throw new IllegalArgumentException("Partition column '" + partitionColumn
                    + "' not in table columns " + columns);
            }
        }

        logger.info("Writing {} to {} partitioned by {}", tableName, destinationPath, partitionColumns);
        try {
            table.write()
                .mode(SaveMode.Overwrite)
                .option("partitionOverwriteMode", "static")
                .partitionBy(partitionColumns.toArray(new String[0]))
                .parquet(destinationPath);
        } catch (Exception e) {
            throw new SinkWriteException(tableName, destinationPath,
                "Failed to write " + tableName + " to " + destinationPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Last path segment of the destination, e.g. "songs" for s3a://bucket/star/songs/.
     */
    static String tableName(String destinationPath) {
        String trimmed = destinationPath;
        while (trimmed.endsWith("/") && trimmed.length() > 1) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }
}
