package com.example.conservation.etl.reader;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts Form 990 summary fields from paginated text filings, one staged record per filing.
 * Labels that cannot be found leave their field null; required ones are listed under
 * {@value #MISSING_LABELS} so the conformance layer can raise them for review.
 */
@Component
public class FilingDocumentSourceReader implements SourceReader {
    private static final Logger log = LoggerFactory.getLogger(FilingDocumentSourceReader.class);

    public static final String MISSING_LABELS = "_missing_labels";
    public static final String PROGRAM_SERVICES = "program_services";

    private static final Pattern FORM_YEAR = Pattern.compile("Form\\s+990\\s*\\((\\d{4})\\)");
    private static final Pattern FILE_YEAR = Pattern.compile("(20\\d{2})");
    private static final Pattern EIN = Pattern.compile("(?<!\\d)(\\d{2}-\\d{7})(?!\\d)");
    private static final String AMOUNT = "\\$\\s*(\\([\\d,]+\\.?\\d*\\)|[\\d,]+\\.?\\d*)";

    private final FilingLabelStrategy labelStrategy;
    private final EtlProperties.Filing filing;

    public FilingDocumentSourceReader(FilingLabelStrategy labelStrategy, EtlProperties properties) {
        this.labelStrategy = labelStrategy;
        this.filing = properties.getFiling();
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.FILING_DOCUMENT;
    }

    @Override
    public Stream<StagedRecord> read(SourceDefinition source, ExtractionContext context) {
        if (!Charset.isSupported(source.getEncoding())) {
            throw new SourceReadException("Unsupported encoding '" + source.getEncoding() + "' for " + source.getLocation());
        }
        Charset charset = Charset.forName(source.getEncoding());
        List<Path> files = listFilings(source);
        log.info("Reading {} filing document(s) from [{}]", files.size(), source.getLocation());

        return files.stream().flatMap(file -> {
            context.incrementAndGetRecordsRead();
            String ref = file.getFileName().toString();
            try {
                FilingDocument document = new FilingDocument(ref, Files.readString(file, charset));
                return Stream.of(extract(document));
            } catch (IOException e) {
                // One unreadable filing does not stop the others.
                context.recordSkipped(new SourceReadException("Unreadable filing: " + e.getMessage(), ref));
                return Stream.empty();
            }
        });
    }

    private List<Path> listFilings(SourceDefinition source) {
        Path location = source.getLocation();
        if (location == null || !Files.exists(location)) {
            throw new SourceReadException("Filing location not found: " + location);
        }
        if (Files.isRegularFile(location)) {
            return List.of(location);
        }
        PathMatcher matcher = location.getFileSystem().getPathMatcher("glob:" + source.getFilePattern());
        try (Stream<Path> entries = Files.list(location)) {
            return entries.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SourceReadException("Unable to list filings in " + location, e);
        }
    }

    StagedRecord extract(FilingDocument document) {
        String text = document.getText();
        Map<String, Object> data = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        data.put("file_name", document.getFileName());
        Integer taxYear = taxYear(document.getFileName(), text);
        data.put("tax_year", taxYear);
        data.put("fiscal_year", taxYear);
        Matcher ein = EIN.matcher(text);
        data.put("ein", ein.find() ? ein.group(1) : null);

        filing.getTextLabels().forEach((field, labels) ->
                data.put(field, labelStrategy.findText(document, labels).orElse(null)));

        filing.getLabels().forEach((field, labels) -> {
            Optional<String> value = labelStrategy.findNumber(document, labels);
            data.put(field, value.orElse(null));
            if (value.isEmpty() && filing.getRequiredLabels().contains(field)) {
                missing.add(field);
            }
        });
        if (!missing.isEmpty()) {
            log.warn("Filing {} is missing required label(s) {}", document.getFileName(), missing);
        }

        data.put(PROGRAM_SERVICES, programServices(document));
        data.put(MISSING_LABELS, missing);
        return new StagedRecord(document.getFileName(), data);
    }

    private static Integer taxYear(String fileName, String text) {
        Matcher form = FORM_YEAR.matcher(text);
        if (form.find()) {
            return Integer.valueOf(form.group(1));
        }
        Matcher name = FILE_YEAR.matcher(fileName);
        return name.find() ? Integer.valueOf(name.group(1)) : null;
    }

    /**
     * Part III lines read "4a (Code: ...) (Expenses $ X including grants of $ Y) (Revenue $ Z)".
     * Matching is per page so a line never borrows amounts from another page.
     */
    private List<Map<String, Object>> programServices(FilingDocument document) {
        List<Map<String, Object>> lines = new ArrayList<>();
        filing.getProgramServices().forEach((code, name) -> {
            Pattern pattern = Pattern.compile("(?m)^\\s*" + Pattern.quote(code) + "\\b.*?Expens\\s*es\\s*" + AMOUNT
                            + ".*?grants\\s+of\\s*" + AMOUNT + ".*?Revenue\\s*" + AMOUNT,
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
            for (String page : document.getPages()) {
                Matcher m = pattern.matcher(page);
                if (m.find()) {
                    Map<String, Object> line = new LinkedHashMap<>();
                    line.put("program_code", code);
                    line.put("program_name", name);
                    line.put("expenses", m.group(1));
                    line.put("grants", m.group(2));
                    line.put("revenue", m.group(3));
                    lines.add(line);
                    break;
                }
            }
        });
        return lines;
    }
}
