package com.example.conservation.etl.model;

import java.util.Objects;

/**
 * Outcome of a single data-quality rule for a single record.
 * Produced by the conformance layer (coercion failures, missing filing labels)
 * and by the validator; never mutates the record it describes.
 */
public class ValidationResult {

    private final EntityType entityType;
    private final String recordRef;
    private final String rule;
    private final ViolationCategory category;
    private final Severity severity;
    private final String message;

    public ValidationResult(EntityType entityType, String recordRef, String rule,
                            ViolationCategory category, Severity severity, String message) {
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.recordRef = Objects.requireNonNull(recordRef, "recordRef");
        this.rule = Objects.requireNonNull(rule, "rule");
        this.category = Objects.requireNonNull(category, "category");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message;
    }

    public static ValidationResult blocking(EntityType entityType, String recordRef, String rule,
                                            ViolationCategory category, String message) {
        return new ValidationResult(entityType, recordRef, rule, category, Severity.BLOCKING, message);
    }

    public static ValidationResult warning(EntityType entityType, String recordRef, String rule,
                                           ViolationCategory category, String message) {
        return new ValidationResult(entityType, recordRef, rule, category, Severity.WARNING, message);
    }

    public EntityType getEntityType() { return entityType; }
    public String getRecordRef() { return recordRef; }
    public String getRule() { return rule; }
    public ViolationCategory getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    @Override
    public String toString() {
        return severity + " " + entityType + " " + recordRef + " [" + rule + "]: " + message;
    }
}
