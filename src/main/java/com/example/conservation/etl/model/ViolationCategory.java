package com.example.conservation.etl.model;

public enum ViolationCategory {
    CONFORMANCE,
    COMPLETENESS,
    UNIQUENESS,
    REFERENTIAL_INTEGRITY,
    BUSINESS_RULE
}
