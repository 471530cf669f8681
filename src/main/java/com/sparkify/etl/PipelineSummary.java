package com.sparkify.etl;

import java.util.EnumMap;
import java.util.Map;

/**
 * Row counts of the tables written by one pipeline run.
 */
public class PipelineSummary {

    private final Map<OutputTable, Long> rowCounts = new EnumMap<>(OutputTable.class);

    void record(OutputTable table, long rows) {
        rowCounts.put(table, rows);
    }

    /**
     * @return rows written for the table, or -1 if it was not written
     */
    public long rowCount(OutputTable table) {
        Long rows = rowCounts.get(table);
        return rows == null ? -1 : rows;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PipelineSummary{");
        boolean first = true;
        for (Map.Entry<OutputTable, Long> entry : rowCounts.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey().directory()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
