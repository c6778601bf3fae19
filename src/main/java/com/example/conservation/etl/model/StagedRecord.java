package com.example.conservation.etl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single source-native row or entry, before conformance.
 * Field names are the source's own; values are whatever the reader produced
 * (strings for tabular data, strings/numbers/lists/maps for documents).
 */
public class StagedRecord {

    private final String sourceRef;
    private final Map<String, Object> data;

    public StagedRecord(String sourceRef, Map<String, Object> data) {
        this.sourceRef = Objects.requireNonNull(sourceRef, "sourceRef cannot be null");
        this.data = new LinkedHashMap<>(Objects.requireNonNull(data, "Row data cannot be null"));
    }

    /**
     * Identifies where the record came from, e.g. {@code donors.csv#12} or {@code projects.json#3.2}.
     */
    public String getSourceRef() {
        return sourceRef;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public Object getValue(String fieldName) {
        return data.get(fieldName);
    }

    public String getString(String fieldName) {
        Object value = data.get(fieldName);
        return (value != null) ? value.toString() : null;
    }

    public boolean isPopulated(String fieldName) {
        Object value = data.get(fieldName);
        return value != null && !value.toString().trim().isEmpty();
    }

    @Override
    public String toString() {
        return "StagedRecord{" + "sourceRef='" + sourceRef + '\'' + ", data=" + data + '}';
    }
}
