package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.StagedRecord;
import com.example.conservation.etl.model.ValidationResult;

import java.util.List;

/**
 * Maps staged records of one entity type onto its typed record.
 *
 * @param <T> The conformed record type.
 */
public interface EntityConformer<T extends ConformedRecord> {

    EntityType getEntityType();

    /**
     * Converts one staged record. Foreign keys are resolved through {@code lookups}; an unresolved
     * reference is left null for the validator to report.
     *
     * @throws com.example.conservation.etl.exception.ConformanceException If a value cannot be coerced.
     */
    T conform(StagedRecord staged, DimensionLookups lookups);

    /**
     * Non-blocking findings about a successfully conformed record.
     */
    default List<ValidationResult> warnings(StagedRecord staged, T conformed) {
        return List.of();
    }

    /**
     * Hook for measures derived across the whole batch. Called once, after every record is conformed.
     */
    default void completeBatch(List<T> records) {
    }
}
