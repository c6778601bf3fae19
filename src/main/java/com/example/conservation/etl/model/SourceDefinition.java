package com.example.conservation.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Where and how to extract one entity's staged records.
 */
@Value
@Builder
public class SourceDefinition {
    EntityType entityType;
    SourceType sourceType;
    Path location;
    /** Nested array field to flatten one level into repeated records, or null. */
    String flattenField;
    /** Whether a parent with an empty/missing flatten array still yields one record. */
    @Builder.Default
    boolean keepEmptyFlatten = true;
    @Singular
    List<String> requiredColumns;
    @Builder.Default
    String delimiter = ",";
    @Builder.Default
    String encoding = "UTF-8";
    @Builder.Default
    String filePattern = "*990*.txt";

    public String describe() {
        return entityType + " <- " + sourceType + " " + location;
    }
}
