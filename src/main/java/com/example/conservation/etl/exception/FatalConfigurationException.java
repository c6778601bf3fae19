package com.example.conservation.etl.exception;

/**
 * Missing or invalid store connection, source configuration or schema. Aborts the run
 * before any entity is processed.
 */
public class FatalConfigurationException extends EtlException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
