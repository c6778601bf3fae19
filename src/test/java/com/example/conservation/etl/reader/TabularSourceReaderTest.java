package com.example.conservation.etl.reader;

import com.example.conservation.etl.TestFixtures;
import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.model.StagedRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TabularSourceReader Tests")
class TabularSourceReaderTest {

    @TempDir
    Path dir;

    private final TabularSourceReader reader = new TabularSourceReader();

    private static SourceDefinition.SourceDefinitionBuilder csv(Path file) {
        return SourceDefinition.builder()
                .entityType(EntityType.DONOR)
                .sourceType(SourceType.TABULAR)
                .location(file);
    }

    private List<StagedRecord> readAll(SourceDefinition source, ExtractionContext context) {
        try (Stream<StagedRecord> records = reader.read(source, context)) {
            return records.collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("Should key each row by the header names and stage blanks as null")
    void testRead_HeaderAndBlanks() {
        Path file = TestFixtures.writeFile(dir, "donors.csv",
                "donor_id, first_name ,email\nD001,Ann,ann@example.org\nD002,Bo,\n");
        ExtractionContext context = new ExtractionContext(EntityType.DONOR, 10);

        List<StagedRecord> rows = readAll(csv(file).build(), context);

        assertEquals(2, rows.size());
        assertEquals("D001", rows.get(0).getValue("donor_id"));
        assertEquals("Ann", rows.get(0).getValue("first_name"));
        assertNull(rows.get(1).getValue("email"));
        assertEquals("donors.csv#2", rows.get(0).getSourceRef());
        assertEquals(2, context.getRecordsRead());
        assertEquals(0, context.getRecordsSkipped());
    }

    @Test
    @DisplayName("Should honour quoted values containing the delimiter")
    void testRead_QuotedDelimiter() {
        Path file = TestFixtures.writeFile(dir, "campaigns.csv",
                "campaign_id,description\nC001,\"Elk, deer and more\"\n");

        List<StagedRecord> rows = readAll(csv(file).build(), new ExtractionContext(EntityType.CAMPAIGN, 10));

        assertEquals("Elk, deer and more", rows.get(0).getValue("description"));
    }

    @Test
    @DisplayName("Should read semicolon delimited files")
    void testRead_CustomDelimiter() {
        Path file = TestFixtures.writeFile(dir, "donors.csv", "donor_id;city\nD001;Missoula\n");

        List<StagedRecord> rows = readAll(csv(file).delimiter(";").build(), new ExtractionContext(EntityType.DONOR, 10));

        assertEquals("Missoula", rows.get(0).getValue("city"));
    }

    @Test
    @DisplayName("Should fail the source when the file is missing")
    void testRead_MissingFile() {
        SourceDefinition source = csv(dir.resolve("absent.csv")).build();

        assertThrows(SourceReadException.class, () -> reader.read(source, new ExtractionContext(EntityType.DONOR, 10)));
    }

    @Test
    @DisplayName("Should fail the source on an unsupported encoding")
    void testRead_UnsupportedEncoding() {
        Path file = TestFixtures.writeFile(dir, "donors.csv", "donor_id\nD001\n");
        SourceDefinition source = csv(file).encoding("NOT-A-CHARSET").build();

        assertThrows(SourceReadException.class, () -> reader.read(source, new ExtractionContext(EntityType.DONOR, 10)));
    }

    @Test
    @DisplayName("Factory should skip rows missing required columns and count them")
    void testFactory_RequiredColumns() {
        Path file = TestFixtures.writeFile(dir, "donors.csv", "donor_id,email\nD001,a@b.org\n,c@d.org\nD003,\n");
        SourceDefinition source = csv(file).requiredColumn("donor_id").build();
        SourceReaderFactory factory = new SourceReaderFactory(List.of(reader));
        ExtractionContext context = new ExtractionContext(EntityType.DONOR, 10);

        List<StagedRecord> rows;
        try (Stream<StagedRecord> records = factory.open(source, context)) {
            rows = records.collect(Collectors.toList());
        }

        assertEquals(2, rows.size());
        assertEquals(3, context.getRecordsRead());
        assertEquals(1, context.getRecordsSkipped());
        assertTrue(context.getSkippedIssues().get(0).startsWith("donors.csv#3"));
        assertTrue(context.getSkippedIssues().get(0).contains("0 of 1 required columns populated"));
    }

    @Test
    @DisplayName("Factory should reject a source type without a registered reader")
    void testFactory_UnsupportedType() {
        SourceReaderFactory factory = new SourceReaderFactory(List.of(reader));
        SourceDefinition source = SourceDefinition.builder()
                .entityType(EntityType.HABITAT)
                .sourceType(SourceType.STRUCTURED_DOCUMENT)
                .location(dir.resolve("habitats.json"))
                .build();

        assertFalse(factory.supports(SourceType.STRUCTURED_DOCUMENT));
        assertThrows(SourceReadException.class, () -> factory.open(source, new ExtractionContext(EntityType.HABITAT, 10)));
    }
}
