package com.example.conservation.etl.model;

import lombok.Value;

/**
 * A fact's reference to a dimension, kept with the natural value it was resolved from
 * so that unresolved references can be reported with the offending value.
 */
@Value
public class ForeignKeyRef {
    String field;
    EntityType dimension;
    String naturalValue;
    Long surrogateKey;
    boolean required;
}
