package com.example.conservation.etl.quality;

import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.model.ViolationCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for rules that judge each record on its own.
 */
public abstract class RecordRule<T extends ConformedRecord> implements ValidationRule<T> {

    private final String ruleName;
    private final ViolationCategory category;
    private final Severity severity;

    protected RecordRule(String ruleName, ViolationCategory category, Severity severity) {
        this.ruleName = ruleName;
        this.category = category;
        this.severity = severity;
    }

    /**
     * @return A message describing the violation, or empty when the record passes.
     */
    protected abstract Optional<String> check(T record);

    @Override
    public String getRuleName() {
        return ruleName;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public List<ValidationResult> evaluate(List<T> batch, DimensionLookups lookups) {
        List<ValidationResult> results = new ArrayList<>();
        for (T record : batch) {
            check(record).ifPresent(message -> results.add(new ValidationResult(
                    record.getEntityType(), record.getRecordRef(), ruleName, category, severity, message)));
        }
        return results;
    }
}
