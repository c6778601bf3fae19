package com.example.conservation.etl.reader;

import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams a top-level JSON array of objects, one staged record per object.
 * Nested values are kept as lists and maps for the flattener and conformers.
 */
@Component
public class StructuredDocumentSourceReader implements SourceReader {
    private static final Logger log = LoggerFactory.getLogger(StructuredDocumentSourceReader.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ENTRY_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public StructuredDocumentSourceReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.STRUCTURED_DOCUMENT;
    }

    @Override
    public Stream<StagedRecord> read(SourceDefinition source, ExtractionContext context) {
        if (!Files.isRegularFile(source.getLocation())) {
            throw new SourceReadException("Structured document not found: " + source.getLocation());
        }
        if (!Charset.isSupported(source.getEncoding())) {
            throw new SourceReadException("Unsupported encoding '" + source.getEncoding() + "' for " + source.getLocation());
        }
        String fileName = source.getLocation().getFileName().toString();

        JsonParser parser;
        try {
            Reader in = new InputStreamReader(Files.newInputStream(source.getLocation()),
                    Charset.forName(source.getEncoding()).newDecoder().onMalformedInput(CodingErrorAction.REPORT));
            parser = objectMapper.getFactory().createParser(in);
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                parser.close();
                throw new SourceReadException("Expected a top-level array in " + source.getLocation());
            }
        } catch (IOException e) {
            throw new SourceReadException("Unable to open structured document " + source.getLocation(), e);
        }
        log.info("Reading structured document [{}]", source.getLocation());

        Spliterator<StagedRecord> entries = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            private int index = 0;

            @Override
            public boolean tryAdvance(Consumer<? super StagedRecord> action) {
                try {
                    while (true) {
                        JsonToken token = parser.nextToken();
                        if (token == null) {
                            throw new SourceReadException("Unterminated array in " + source.getLocation());
                        }
                        if (token == JsonToken.END_ARRAY) {
                            return false;
                        }
                        index++;
                        context.incrementAndGetRecordsRead();
                        String ref = fileName + "#" + index;
                        if (token != JsonToken.START_OBJECT) {
                            parser.skipChildren();
                            context.recordSkipped(new SourceReadException("Entry is not an object: " + token, ref));
                            continue;
                        }
                        LinkedHashMap<String, Object> entry = objectMapper.readValue(parser, ENTRY_TYPE);
                        action.accept(new StagedRecord(ref, entry));
                        return true;
                    }
                } catch (IOException e) {
                    throw new SourceReadException("Malformed structured document " + source.getLocation(), e);
                }
            }
        };

        return StreamSupport.stream(entries, false).onClose(() -> {
            try {
                parser.close();
            } catch (IOException e) {
                log.warn("Error closing structured document {}: {}", source.getLocation(), e.getMessage());
            }
        });
    }
}
