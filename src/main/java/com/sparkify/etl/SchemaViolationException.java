package com.sparkify.etl;

/**
 * Raised when raw input does not match the registered schema: a required column is
 * missing or null, or a value cannot be read as its declared type.
 */
public class SchemaViolationException extends EtlException {

    private final RecordType recordType;
    private final String column;

    public SchemaViolationException(RecordType recordType, String column, String message) {
        super(message, null);
        this.recordType = recordType;
        this.column = column;
    }

    public SchemaViolationException(RecordType recordType, String message, Throwable cause) {
        super(message, cause);
        this.recordType = recordType;
        this.column = null;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    /**
     * @return the offending column, or null when the engine rejected the record as a whole
     */
    public String getColumn() {
        return column;
    }
}
