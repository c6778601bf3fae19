package com.example.conservation.etl.exception;

/**
 * A single staged value cannot be coerced to its schema type.
 */
public class ConformanceException extends EtlException {
    private final String field;
    private final Object rawValue;

    public ConformanceException(String field, Object rawValue, String expectedType) {
        super(String.format("Field '%s' value '%s' is not a valid %s", field, rawValue, expectedType));
        this.field = field;
        this.rawValue = rawValue;
    }

    public String getField() {
        return field;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
