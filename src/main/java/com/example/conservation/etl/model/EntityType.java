package com.example.conservation.etl.model;

/**
 * Closed set of entities in the conservation star schema.
 * Declaration order is the load order: dimensions precede the facts that reference them.
 */
public enum EntityType {
    DONOR(Kind.DIMENSION),
    CAMPAIGN(Kind.DIMENSION),
    HABITAT(Kind.DIMENSION),
    PROJECT(Kind.DIMENSION),
    DATE(Kind.DIMENSION),
    DONATION(Kind.FACT),
    ELK_POPULATION(Kind.FACT),
    PROJECT_METRIC(Kind.FACT),
    FINANCIAL_FILING(Kind.FACT),
    PROGRAM_SERVICE_LINE(Kind.FACT);

    public enum Kind { DIMENSION, FACT }

    private final Kind kind;

    EntityType(Kind kind) {
        this.kind = kind;
    }

    public boolean isDimension() {
        return kind == Kind.DIMENSION;
    }

    public boolean isFact() {
        return kind == Kind.FACT;
    }

    /**
     * The date dimension is derived from facts rather than read from a source.
     */
    public boolean isSourced() {
        return this != DATE;
    }
}
