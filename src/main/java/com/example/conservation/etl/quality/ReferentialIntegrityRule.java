package com.example.conservation.etl.quality;

import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.model.FactRecord;
import com.example.conservation.etl.model.ForeignKeyRef;
import com.example.conservation.etl.model.ReferentialIntegrityViolation;
import com.example.conservation.etl.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Every populated foreign key must resolve in its dimension. Missing required keys
 * are left to the completeness rules.
 */
public class ReferentialIntegrityRule<T extends FactRecord> implements ValidationRule<T> {
    private static final Logger log = LoggerFactory.getLogger(ReferentialIntegrityRule.class);

    @Override
    public String getRuleName() {
        return "referential-integrity";
    }

    @Override
    public List<ValidationResult> evaluate(List<T> batch, DimensionLookups lookups) {
        List<ValidationResult> results = new ArrayList<>();
        for (T record : batch) {
            for (ForeignKeyRef reference : record.getForeignKeys()) {
                if (reference.getNaturalValue() == null || lookups.contains(reference.getDimension(), reference.getNaturalValue())) {
                    continue;
                }
                log.warn("Unresolved {} '{}' on {} record {}", reference.getField(), reference.getNaturalValue(),
                        record.getEntityType(), record.getRecordRef());
                results.add(new ReferentialIntegrityViolation(record.getEntityType(), record.getRecordRef(), reference));
            }
        }
        return results;
    }
}
