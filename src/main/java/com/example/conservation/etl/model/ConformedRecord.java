package com.example.conservation.etl.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Typed output of the conformance layer. One concrete subclass per entity type,
 * so validation, anomaly detection and loading work on typed data only.
 */
@Getter
@Setter
public abstract class ConformedRecord {

    /** Source reference of the staged record this record was conformed from. */
    private String recordRef;

    public abstract EntityType getEntityType();

    /** Business key used for uniqueness checks and upsert matching. */
    public abstract String getNaturalKey();
}
