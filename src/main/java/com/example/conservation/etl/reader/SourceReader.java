package com.example.conservation.etl.reader;

import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;

import java.util.stream.Stream;

/**
 * Interface for components that extract staged records from one kind of source.
 */
public interface SourceReader {

    /**
     * The source type this reader handles.
     */
    SourceType getSourceType();

    /**
     * Opens the source and returns a lazy stream of its records. Closing the stream
     * releases the underlying file.
     *
     * @param source  Where and how to read.
     * @param context Per-entity counters; row-level failures are recorded here.
     * @return Stream of staged records in source order.
     * @throws com.example.conservation.etl.exception.SourceReadException If the source is missing,
     *         structurally malformed or in an unsupported encoding.
     */
    Stream<StagedRecord> read(SourceDefinition source, ExtractionContext context);
}
