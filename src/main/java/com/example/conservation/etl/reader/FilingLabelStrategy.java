package com.example.conservation.etl.reader;

import java.util.List;
import java.util.Optional;

/**
 * Locates labelled values in a filing. Implementations decide how a label is matched
 * across layout variations; the caller supplies the synonyms for each field.
 */
public interface FilingLabelStrategy {

    /**
     * @return The raw numeric token (e.g. {@code 52,185,551.} or {@code (1,200)}) that belongs
     *         to the first matching label, or empty when none of the labels is found with a value.
     */
    Optional<String> findNumber(FilingDocument document, List<String> labels);

    /**
     * @return The text that follows the first matching label, or empty.
     */
    Optional<String> findText(FilingDocument document, List<String> labels);
}
