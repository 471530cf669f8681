package com.sparkify.etl;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The five star-schema tables, each with its directory under the output root and its
 * partition columns.
 */
public enum OutputTable {
    SONGS("songs", "year", "artist_id"),
    ARTISTS("artists"),
    USERS("users"),
    TIME("time", "year", "month"),
    SONGPLAYS("songplays", "year", "month");

    private final String directory;
    private final List<String> partitionColumns;

    OutputTable(String directory, String... partitionColumns) {
        this.directory = directory;
        this.partitionColumns = Collections.unmodifiableList(Arrays.asList(partitionColumns));
    }

    public String directory() {
        return directory;
    }

    public List<String> partitionColumns() {
        return partitionColumns;
    }

    public String destination(String outputRoot) {
        if (outputRoot.endsWith("/")) {
            return outputRoot + directory;
        }
        return outputRoot + "/" + directory;
    }
}
