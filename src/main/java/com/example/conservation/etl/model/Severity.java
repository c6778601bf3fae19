package com.example.conservation.etl.model;

public enum Severity {
    /** Excludes the record from load. */
    BLOCKING,
    /** Logged and counted; the record still loads. */
    WARNING
}
