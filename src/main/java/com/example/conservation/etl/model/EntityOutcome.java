package com.example.conservation.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-entity result of a run. Failures are carried as data so that one entity's
 * error never propagates into another entity's processing.
 */
@Value
@Builder(toBuilder = true)
public class EntityOutcome {
    EntityType entity;
    EntityStatus status;
    long read;
    long skipped;
    long conformed;
    long rejected;
    long loaded;
    long blockingViolations;
    long warningViolations;
    @Singular("anomaly")
    Map<String, Long> anomaliesByRule;
    /** A bounded sample of violation and skipped-row messages. */
    @Singular
    List<String> issues;
    String error;
    long elapsedMillis;

    public boolean isSucceeded() {
        return status == EntityStatus.SUCCEEDED;
    }

    public static EntityOutcome failed(EntityType entity, String error, long elapsedMillis) {
        return EntityOutcome.builder()
                .entity(entity)
                .status(EntityStatus.FAILED)
                .error(error)
                .elapsedMillis(elapsedMillis)
                .build();
    }

    public static EntityOutcome cancelled(EntityType entity) {
        return EntityOutcome.builder()
                .entity(entity)
                .status(EntityStatus.CANCELLED)
                .error("Run cancelled before " + entity + " completed")
                .build();
    }
}
