package com.example.conservation.etl.model;

/**
 * Blocking violation for a foreign key that does not resolve in its dimension.
 * Always carries the unresolved value for diagnosis.
 */
public class ReferentialIntegrityViolation extends ValidationResult {

    private final String foreignKeyField;
    private final EntityType dimension;
    private final String unresolvedValue;

    public ReferentialIntegrityViolation(EntityType entityType, String recordRef,
                                         ForeignKeyRef reference) {
        super(entityType, recordRef, "referential-integrity", ViolationCategory.REFERENTIAL_INTEGRITY,
                Severity.BLOCKING,
                String.format("%s '%s' does not resolve to a %s row",
                        reference.getField(), reference.getNaturalValue(), reference.getDimension()));
        this.foreignKeyField = reference.getField();
        this.dimension = reference.getDimension();
        this.unresolvedValue = reference.getNaturalValue();
    }

    public String getForeignKeyField() { return foreignKeyField; }
    public EntityType getDimension() { return dimension; }
    public String getUnresolvedValue() { return unresolvedValue; }
}
