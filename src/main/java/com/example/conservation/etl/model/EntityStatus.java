package com.example.conservation.etl.model;

public enum EntityStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
