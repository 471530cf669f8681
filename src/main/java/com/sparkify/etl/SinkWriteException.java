package com.sparkify.etl;

/**
 * Raised when a table cannot be persisted. Tables written earlier in the run are left in place.
 */
public class SinkWriteException extends EtlException {

    private final String table;
    private final String destination;

    public SinkWriteException(String table, String destination, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.destination = destination;
    }

    public String getTable() {
        return table;
    }

    public String getDestination() {
        return destination;
    }
}
