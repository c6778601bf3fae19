package com.example.conservation.etl.exception;

/**
 * Cancellation was requested. Thrown inside a load transaction it rolls that transaction back.
 */
public class RunCancelledException extends EtlException {
    public RunCancelledException(String message) {
        super(message);
    }
}
