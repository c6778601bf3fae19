package com.example.conservation.etl.reader;

import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Picks the reader for a source definition and applies the source-independent policies:
 * required-column checks and one-level flattening.
 */
@Component
public class SourceReaderFactory {
    private static final Logger log = LoggerFactory.getLogger(SourceReaderFactory.class);

    private final Map<SourceType, SourceReader> readers = new EnumMap<>(SourceType.class);

    public SourceReaderFactory(List<SourceReader> readers) {
        readers.forEach(reader -> this.readers.put(reader.getSourceType(), reader));
        log.info("Registered source readers for {}", this.readers.keySet());
    }

    public boolean supports(SourceType sourceType) {
        return readers.containsKey(sourceType);
    }

    /**
     * Opens the source. The returned stream must be closed by the caller.
     */
    public Stream<StagedRecord> open(SourceDefinition source, ExtractionContext context) {
        if (source.getSourceType() == null || source.getLocation() == null) {
            throw new SourceReadException("Source type and location are required for " + source.getEntityType());
        }
        SourceReader reader = readers.get(source.getSourceType());
        if (reader == null) {
            throw new SourceReadException("No reader registered for source type " + source.getSourceType());
        }
        log.debug("Opening {}", source.describe());

        Stream<StagedRecord> records = reader.read(source, context);
        if (!source.getRequiredColumns().isEmpty()) {
            records = records.filter(record -> hasRequiredColumns(record, source, context));
        }
        if (source.getFlattenField() != null) {
            records = records.flatMap(record ->
                    RecordFlattener.flatten(record, source.getFlattenField(), source.isKeepEmptyFlatten()));
        }
        return records;
    }

    private static boolean hasRequiredColumns(StagedRecord record, SourceDefinition source, ExtractionContext context) {
        List<String> absent = source.getRequiredColumns().stream()
                .filter(column -> !record.isPopulated(column))
                .collect(Collectors.toList());
        if (absent.isEmpty()) {
            return true;
        }
        context.recordSkipped(new SourceReadException(
                String.format("%d of %d required columns populated, missing %s",
                        source.getRequiredColumns().size() - absent.size(), source.getRequiredColumns().size(), absent),
                record.getSourceRef()));
        return false;
    }
}
