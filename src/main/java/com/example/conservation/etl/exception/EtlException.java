package com.example.conservation.etl.exception;

/**
 * Base of all pipeline failures. Unchecked; the run coordinator decides at which
 * boundary (record, entity or run) each subtype is recovered.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
