package com.example.conservation.etl.exception;

import com.example.conservation.etl.model.EntityType;

/**
 * Store write failed; the entity's transaction has been rolled back.
 */
public class LoadException extends EtlException {
    private final EntityType entityType;

    public LoadException(EntityType entityType, String message, Throwable cause) {
        super("Load of " + entityType + " failed: " + message, cause);
        this.entityType = entityType;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
