package com.example.conservation.etl.quality;

import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.ValidationResult;

import java.util.List;

/**
 * A single data-quality concern evaluated over one entity's batch. Rules are independent of
 * each other and never modify the records they inspect.
 *
 * @param <T> The record type this rule validates.
 */
public interface ValidationRule<T extends ConformedRecord> {

    String getRuleName();

    /**
     * @return Violations in batch order, possibly empty. Never null.
     */
    List<ValidationResult> evaluate(List<T> batch, DimensionLookups lookups);
}
