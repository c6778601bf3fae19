package com.example.conservation.etl.model;

/**
 * Enumeration of supported source formats.
 */
public enum SourceType {
    TABULAR,             // Delimited file with a header row
    STRUCTURED_DOCUMENT, // JSON array of objects
    FILING_DOCUMENT      // Paginated text of a Form 990 filing
}
