package com.example.conservation.etl.exception;

/**
 * Source missing, structurally unparseable or in an unsupported encoding.
 * When {@code sourceRef} is set the failure is row-level and extraction continues.
 */
public class SourceReadException extends EtlException {
    private final String sourceRef;

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
        this.sourceRef = null;
    }

    public SourceReadException(String message) {
        this(message, (String) null);
    }

    public SourceReadException(String message, String sourceRef) {
        super(message);
        this.sourceRef = sourceRef;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public boolean isRowLevel() {
        return sourceRef != null;
    }
}
