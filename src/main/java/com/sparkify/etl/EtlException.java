package com.sparkify.etl;

/**
 * Base class for failures that abort a pipeline run.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
