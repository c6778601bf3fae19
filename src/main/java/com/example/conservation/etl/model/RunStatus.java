package com.example.conservation.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall run outcome as published in the run report.
 */
public enum RunStatus {
    SUCCESS("success"),
    DEGRADED("degraded"),
    FAILED("failed");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
