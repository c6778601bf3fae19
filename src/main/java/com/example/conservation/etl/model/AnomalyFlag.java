package com.example.conservation.etl.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Informational annotation on a fact record. Never blocks the load;
 * persisted next to the fact for downstream review.
 */
@Value
public class AnomalyFlag {
    EntityType entityType;
    String recordKey;
    String ruleName;
    Severity severity;
    BigDecimal observedValue;
    BigDecimal threshold;
    String detail;
}
