package com.example.conservation.etl.exception;

/**
 * Another run holds the run lock, or the lock file cannot be opened.
 */
public class RunLockException extends EtlException {

    public RunLockException(String message) {
        super(message);
    }

    public RunLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
