package com.example.conservation.etl.reader;

import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads delimited files with a header row. Column names come from the header, exactly as written.
 * Blank cells are staged as null.
 */
@Component
public class TabularSourceReader implements SourceReader {
    private static final Logger log = LoggerFactory.getLogger(TabularSourceReader.class);

    @Override
    public SourceType getSourceType() {
        return SourceType.TABULAR;
    }

    @Override
    public Stream<StagedRecord> read(SourceDefinition source, ExtractionContext context) {
        FileSystemResource resource = new FileSystemResource(source.getLocation());
        if (!resource.exists() || !resource.isReadable()) {
            throw new SourceReadException("Tabular source not found: " + source.getLocation());
        }
        if (!Charset.isSupported(source.getEncoding())) {
            throw new SourceReadException("Unsupported encoding '" + source.getEncoding() + "' for " + source.getLocation());
        }

        String fileName = resource.getFilename();
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(source.getDelimiter());
        // Short rows are padded with empty values; the required-column check reports them.
        tokenizer.setStrict(false);

        LineMapper<StagedRecord> lineMapper = (line, lineNumber) -> {
            FieldSet fieldSet = tokenizer.tokenize(line);
            Map<String, Object> row = new LinkedHashMap<>();
            for (String name : fieldSet.getNames()) {
                String value = fieldSet.readString(name);
                row.put(name, StringUtils.hasText(value) ? value : null);
            }
            return new StagedRecord(fileName + "#" + lineNumber, row);
        };

        FlatFileItemReader<StagedRecord> reader = new FlatFileItemReaderBuilder<StagedRecord>()
                .name("tabularReader_" + source.getEntityType())
                .resource(resource)
                .encoding(source.getEncoding())
                .linesToSkip(1)
                .skippedLinesCallback(header -> tokenizer.setNames(
                        Arrays.stream(tokenizer.tokenize(header).getValues()).map(String::trim).toArray(String[]::new)))
                .lineMapper(lineMapper)
                .saveState(false)
                .build();

        try {
            reader.open(new ExecutionContext());
        } catch (ItemStreamException e) {
            throw new SourceReadException("Unable to open tabular source " + source.getLocation(), e);
        }
        log.info("Reading tabular source [{}], delimiter '{}', encoding {}", source.getLocation(), source.getDelimiter(), source.getEncoding());

        Spliterator<StagedRecord> rows = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super StagedRecord> action) {
                while (true) {
                    StagedRecord next;
                    try {
                        next = reader.read();
                    } catch (FlatFileParseException e) {
                        context.incrementAndGetRecordsRead();
                        context.recordSkipped(new SourceReadException("Unparseable line: " + e.getInput(),
                                fileName + "#" + e.getLineNumber()));
                        continue;
                    } catch (Exception e) {
                        throw new SourceReadException("Failed reading " + source.getLocation(), e);
                    }
                    if (next == null) {
                        return false;
                    }
                    context.incrementAndGetRecordsRead();
                    action.accept(next);
                    return true;
                }
            }
        };

        return StreamSupport.stream(rows, false).onClose(reader::close);
    }
}
