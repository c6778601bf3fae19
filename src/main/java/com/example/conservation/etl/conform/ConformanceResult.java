package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ValidationResult;
import lombok.Value;

import java.util.List;

@Value
public class ConformanceResult {
    EntityType entityType;
    List<ConformedRecord> records;
    /** Coercion failures (blocking, record excluded) and conformance warnings. */
    List<ValidationResult> violations;

    public long getRejectedCount() {
        return violations.stream().filter(ValidationResult::isBlocking).count();
    }
}
