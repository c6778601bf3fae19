package com.example.conservation.etl.service;

import com.example.conservation.etl.TestFixtures;
import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.load.LookupRepository;
import com.example.conservation.etl.model.EntityOutcome;
import com.example.conservation.etl.model.EntityStatus;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.model.RunStatus;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.StagedRecord;
import com.example.conservation.etl.reader.ExtractionContext;
import com.example.conservation.etl.reader.FilingDocumentSourceReader;
import com.example.conservation.etl.reader.LabelProximityStrategy;
import com.example.conservation.etl.reader.SourceReaderFactory;
import com.example.conservation.etl.reader.StructuredDocumentSourceReader;
import com.example.conservation.etl.reader.TabularSourceReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunCoordinator Tests")
class RunCoordinatorTest {

    @TempDir
    Path dir;

    private EmbeddedDatabase store;
    private JdbcTemplate jdbcTemplate;
    private LookupRepository lookups;
    private ThreadPoolTaskExecutor executor;
    private EtlProperties properties;

    @BeforeEach
    void setUp() {
        TestFixtures.copyFixtures(dir);
        store = TestFixtures.embeddedStore();
        jdbcTemplate = new JdbcTemplate(store);
        lookups = new LookupRepository(jdbcTemplate);
        executor = TestFixtures.readerExecutor(2);
        properties = TestFixtures.properties(dir);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        store.shutdown();
    }

    private RunCoordinator coordinator() {
        return TestFixtures.coordinator(properties, store, executor);
    }

    /**
     * A coordinator whose tabular reader waits {@code delayMillis} before reading {@code slowEntity}.
     */
    private RunCoordinator coordinatorWithSlowSource(EntityType slowEntity, long delayMillis) {
        TabularSourceReader slowTabular = new TabularSourceReader() {
            @Override
            public Stream<StagedRecord> read(SourceDefinition source, ExtractionContext context) {
                if (source.getEntityType() == slowEntity) {
                    try {
                        Thread.sleep(delayMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new SourceReadException("Interrupted before reading " + source.describe());
                    }
                }
                return super.read(source, context);
            }
        };
        SourceReaderFactory readers = new SourceReaderFactory(List.of(
                slowTabular,
                new StructuredDocumentSourceReader(TestFixtures.objectMapper()),
                new FilingDocumentSourceReader(new LabelProximityStrategy(), properties)));
        return TestFixtures.coordinator(properties, store, executor, readers);
    }

    private static void assertOutcome(RunReport report, EntityType entity, long loaded, long rejected) {
        EntityOutcome outcome = report.outcomeFor(entity);
        assertNotNull(outcome, "no outcome for " + entity);
        assertEquals(EntityStatus.SUCCEEDED, outcome.getStatus(), entity + ": " + outcome.getError());
        assertEquals(loaded, outcome.getLoaded(), entity + " loaded");
        assertEquals(rejected, outcome.getRejected(), entity + " rejected");
    }

    // ============================================================================
    // Full runs
    // ============================================================================

    @Test
    @DisplayName("Should load every entity of the sample sources")
    void testRun_EndToEnd() {
        RunCoordinator coordinator = coordinator();

        RunReport report = coordinator.run();

        assertEquals(RunStatus.SUCCESS, report.getStatus());
        assertNull(report.getFatalError());
        assertEquals(10, report.getEntities().size());
        assertSame(report, coordinator.getLastReport());

        assertOutcome(report, EntityType.DONOR, 3, 0);
        assertOutcome(report, EntityType.CAMPAIGN, 1, 1);
        assertOutcome(report, EntityType.HABITAT, 3, 0);
        assertOutcome(report, EntityType.PROJECT, 2, 0);
        assertOutcome(report, EntityType.DONATION, 2, 2);
        assertOutcome(report, EntityType.ELK_POPULATION, 4, 0);
        assertOutcome(report, EntityType.PROJECT_METRIC, 3, 0);
        assertOutcome(report, EntityType.FINANCIAL_FILING, 1, 0);
        assertOutcome(report, EntityType.PROGRAM_SERVICE_LINE, 3, 0);
        assertOutcome(report, EntityType.DATE, 731, 0);

        assertEquals(1, report.outcomeFor(EntityType.DONOR).getWarningViolations());
        assertEquals(4, report.outcomeFor(EntityType.DONATION).getRead());
        assertEquals(2, report.outcomeFor(EntityType.DONATION).getBlockingViolations());
        assertEquals(Map.of("large-donation", 1L, "population-decline", 1L, "habitat-at-risk", 1L, "budget-overrun", 2L),
                report.getAnomaliesByRule());
        assertEquals(3L, report.getViolationsBySeverity().get(Severity.BLOCKING));

        assertEquals(List.of("DN001", "DN002"),
                jdbcTemplate.queryForList("SELECT donation_id FROM fact_donation ORDER BY donation_id", String.class));
        assertEquals(5, lookups.countRows("anomaly_flag"));
        assertEquals(20211231, jdbcTemplate.queryForObject("SELECT MIN(date_key) FROM dim_date", Integer.class));
        assertEquals(20231231, jdbcTemplate.queryForObject("SELECT MAX(date_key) FROM dim_date", Integer.class));
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM fact_donation f LEFT JOIN dim_date d ON f.date_key = d.date_key WHERE d.date_key IS NULL",
                Integer.class));
    }

    @Test
    @DisplayName("Should store derived values from the sample sources")
    void testRun_StoredValues() {
        coordinator().run();

        assertEquals(85000L, jdbcTemplate.queryForObject(
                "SELECT total_acres FROM dim_habitat WHERE habitat_id = 'H002'", Long.class));
        assertEquals(-100, jdbcTemplate.queryForObject(
                "SELECT population_change FROM fact_elk_population WHERE habitat_id = 'H001' AND observation_year = 2022", Integer.class));
        assertEquals(1, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM fact_conservation WHERE project_id = 'P002' AND habitat_key IS NULL", Integer.class));
        assertEquals(0, new BigDecimal("-45210").compareTo(jdbcTemplate.queryForObject(
                "SELECT investment_income FROM fact_990_financial WHERE fiscal_year = 2022", BigDecimal.class)));
        assertEquals(0, new BigDecimal("35850000").compareTo(jdbcTemplate.queryForObject(
                "SELECT SUM(expenses) FROM fact_990_program_service", BigDecimal.class)));
        assertEquals(0, new BigDecimal("35850000").compareTo(jdbcTemplate.queryForObject(
                "SELECT program_services_expenses FROM fact_990_financial WHERE fiscal_year = 2022", BigDecimal.class)));
    }

    @Test
    @DisplayName("A second run over unchanged sources should leave the store unchanged")
    void testRun_Idempotent() {
        RunCoordinator coordinator = coordinator();
        coordinator.run();
        Map<String, Long> donorKeys = lookups.loadKeys(EntityType.DONOR);
        List<Map<String, Object>> elk = jdbcTemplate.queryForList("SELECT * FROM fact_elk_population ORDER BY row_id");
        List<Map<String, Object>> flags = jdbcTemplate.queryForList("SELECT * FROM anomaly_flag ORDER BY entity_type, record_key, rule_name");

        RunReport second = coordinator.run();

        assertEquals(RunStatus.SUCCESS, second.getStatus());
        assertEquals(donorKeys, lookups.loadKeys(EntityType.DONOR));
        assertEquals(elk, jdbcTemplate.queryForList("SELECT * FROM fact_elk_population ORDER BY row_id"));
        assertEquals(flags, jdbcTemplate.queryForList("SELECT * FROM anomaly_flag ORDER BY entity_type, record_key, rule_name"));
        assertEquals(3, lookups.countRows("dim_donor"));
        assertEquals(731, lookups.countRows("dim_date"));
    }

    @Test
    @DisplayName("A value too large for its store column should reject only that record")
    void testRun_OversizedValue() {
        TestFixtures.writeFile(dir, "donations.csv", String.join("\n",
                "donation_id,donor_id,campaign_id,donation_date,amount,payment_method,is_recurring,notes",
                "DN001,D001,C001,2023-02-10,250.00,Credit Card,true,",
                "DN002,D002,C001,2023-03-15,15000.00,Check,false,Major gift",
                "DN003,D999,C001,2023-04-01,100.00,Cash,false,Unknown donor",
                "DN004,D003,C002,2023-05-20,75.00,Cash,no,Campaign was rejected",
                "DN005,D001,C001,2023-06-01,123456789012345678901.00,Check,false,Typo in amount",
                ""));

        RunReport report = coordinator().run();

        assertEquals(RunStatus.SUCCESS, report.getStatus());
        assertOutcome(report, EntityType.DONATION, 2, 3);
        assertEquals(3, report.outcomeFor(EntityType.DONATION).getBlockingViolations());
        assertTrue(report.outcomeFor(EntityType.DONATION).getIssues().stream()
                .anyMatch(issue -> issue.contains("[column-fit]") && issue.contains("amount")));
        assertEquals(List.of("DN001", "DN002"),
                jdbcTemplate.queryForList("SELECT donation_id FROM fact_donation ORDER BY donation_id", String.class));
    }

    @Test
    @DisplayName("A large population increase should store its change percentage")
    void testRun_LargePopulationChange() {
        TestFixtures.writeFile(dir, "habitat_areas.json", "[\n"
                + "  {\"habitat_id\": \"H001\", \"habitat_name\": \"Bitterroot Range\", \"state\": \"MT\",\n"
                + "   \"conservation_status\": \"Stable\",\n"
                + "   \"population_counts\": [{\"year\": 2022, \"elk_count\": 1}, {\"year\": 2023, \"elk_count\": 20000000}]}\n"
                + "]\n");

        RunReport report = coordinator().run();

        assertOutcome(report, EntityType.ELK_POPULATION, 2, 0);
        assertEquals(0, new BigDecimal("1999999900.00").compareTo(jdbcTemplate.queryForObject(
                "SELECT population_change_pct FROM fact_elk_population WHERE observation_year = 2023", BigDecimal.class)));
    }

    @Test
    @DisplayName("A filing without a total revenue line should load with an empty field and a warning")
    void testRun_FilingLabelMissing() throws IOException {
        Path filing = dir.resolve("filings/rmef_990_2022.txt");
        List<String> lines = Files.readAllLines(filing).stream()
                .filter(line -> !line.contains("Total revenue"))
                .collect(Collectors.toList());
        Files.write(filing, lines);

        RunReport report = coordinator().run();

        assertEquals(RunStatus.SUCCESS, report.getStatus());
        assertOutcome(report, EntityType.FINANCIAL_FILING, 1, 0);
        EntityOutcome outcome = report.outcomeFor(EntityType.FINANCIAL_FILING);
        assertEquals(0, outcome.getBlockingViolations());
        assertEquals(1, outcome.getWarningViolations());
        assertTrue(outcome.getIssues().stream()
                .anyMatch(issue -> issue.startsWith("WARNING") && issue.contains("[filing-label-missing]")
                        && issue.contains("total_revenue")));
        assertNull(jdbcTemplate.queryForObject(
                "SELECT total_revenue FROM fact_990_financial WHERE fiscal_year = 2022", BigDecimal.class));
        assertOutcome(report, EntityType.PROGRAM_SERVICE_LINE, 3, 0);
    }

    // ============================================================================
    // Degraded and failed runs
    // ============================================================================

    @Test
    @DisplayName("A missing fact source should fail only that entity")
    void testRun_MissingFactSource() throws IOException {
        Files.delete(dir.resolve("donations.csv"));

        RunReport report = coordinator().run();

        assertEquals(RunStatus.DEGRADED, report.getStatus());
        EntityOutcome donation = report.outcomeFor(EntityType.DONATION);
        assertEquals(EntityStatus.FAILED, donation.getStatus());
        assertTrue(donation.getError().contains("donations.csv"));
        assertOutcome(report, EntityType.DONOR, 3, 0);
        assertOutcome(report, EntityType.ELK_POPULATION, 4, 0);
        assertEquals(0, lookups.countRows("fact_donation"));
    }

    @Test
    @DisplayName("A dimension whose load fails should fail alone and keep its batch counts")
    void testRun_DimensionLoadFailure() {
        jdbcTemplate.execute("ALTER TABLE dim_campaign ADD CONSTRAINT ck_campaign_goal CHECK (goal_amount < 0)");

        RunReport report = coordinator().run();

        assertEquals(RunStatus.DEGRADED, report.getStatus());
        EntityOutcome campaign = report.outcomeFor(EntityType.CAMPAIGN);
        assertEquals(EntityStatus.FAILED, campaign.getStatus());
        assertNotNull(campaign.getError());
        assertEquals(2, campaign.getRead());
        assertEquals(1, campaign.getRejected());
        assertEquals(1, campaign.getBlockingViolations());
        assertEquals(0, campaign.getLoaded());
        assertEquals(0, lookups.countRows("dim_campaign"));

        assertOutcome(report, EntityType.DONOR, 3, 0);
        assertOutcome(report, EntityType.HABITAT, 3, 0);
        assertOutcome(report, EntityType.ELK_POPULATION, 4, 0);
        // Without stored campaigns no donation resolves.
        assertOutcome(report, EntityType.DONATION, 0, 4);
    }

    @Test
    @DisplayName("A fact whose load fails should roll back and keep its read, rejected and anomaly counts")
    void testRun_FactLoadFailure() {
        jdbcTemplate.execute("ALTER TABLE fact_donation ADD CONSTRAINT ck_donation_amount CHECK (amount < 1000)");

        RunReport report = coordinator().run();

        assertEquals(RunStatus.DEGRADED, report.getStatus());
        EntityOutcome donation = report.outcomeFor(EntityType.DONATION);
        assertEquals(EntityStatus.FAILED, donation.getStatus());
        assertNotNull(donation.getError());
        assertEquals(4, donation.getRead());
        assertEquals(2, donation.getRejected());
        assertEquals(2, donation.getBlockingViolations());
        assertEquals(0, donation.getLoaded());
        assertEquals(Map.of("large-donation", 1L), donation.getAnomaliesByRule());
        assertEquals(0, lookups.countRows("fact_donation"));
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM anomaly_flag WHERE entity_type = 'DONATION'", Integer.class));
        assertOutcome(report, EntityType.ELK_POPULATION, 4, 0);
    }

    @Test
    @DisplayName("An extraction exceeding the read timeout should fail only that entity")
    void testRun_ReadTimeout() {
        properties.setReadTimeout(Duration.ofSeconds(2));

        RunReport report = coordinatorWithSlowSource(EntityType.CAMPAIGN, 10_000).run();

        assertEquals(RunStatus.DEGRADED, report.getStatus());
        EntityOutcome campaign = report.outcomeFor(EntityType.CAMPAIGN);
        assertEquals(EntityStatus.FAILED, campaign.getStatus());
        assertTrue(campaign.getError().contains("timed out"), campaign.getError());
        assertEquals(0, lookups.countRows("dim_campaign"));
        assertOutcome(report, EntityType.DONOR, 3, 0);
        assertOutcome(report, EntityType.PROJECT, 2, 0);
        assertOutcome(report, EntityType.ELK_POPULATION, 4, 0);
    }

    @Test
    @DisplayName("Entities not started when the run timeout passes should fail while finished ones stay loaded")
    void testRun_RunTimeout() {
        properties.setRunTimeout(Duration.ofSeconds(2));

        RunReport report = coordinatorWithSlowSource(EntityType.DONOR, 2_500).run();

        assertEquals(RunStatus.DEGRADED, report.getStatus());
        assertOutcome(report, EntityType.DONOR, 3, 0);
        assertOutcome(report, EntityType.CAMPAIGN, 1, 1);
        for (EntityType fact : List.of(EntityType.DONATION, EntityType.ELK_POPULATION, EntityType.PROJECT_METRIC,
                EntityType.FINANCIAL_FILING, EntityType.PROGRAM_SERVICE_LINE)) {
            EntityOutcome outcome = report.outcomeFor(fact);
            assertEquals(EntityStatus.FAILED, outcome.getStatus(), fact.name());
            assertTrue(outcome.getError().contains("Run timeout"), outcome.getError());
        }
        assertNull(report.outcomeFor(EntityType.DATE));
        assertEquals(3, lookups.countRows("dim_donor"));
        assertEquals(0, lookups.countRows("fact_donation"));
    }

    @Test
    @DisplayName("Cancelling before the run should cancel every entity and write nothing")
    void testRun_CancelledBeforeStart() {
        RunCoordinator coordinator = coordinator();
        coordinator.requestCancellation();

        RunReport report = coordinator.run();

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertFalse(report.getEntities().isEmpty());
        assertTrue(report.getEntities().stream().allMatch(o -> o.getStatus() == EntityStatus.CANCELLED));
        assertEquals(0, lookups.countRows("dim_donor"));
        assertEquals(0, lookups.countRows("fact_donation"));
        assertFalse(coordinator.isCancellationRequested());
    }

    @Test
    @DisplayName("A run lock held elsewhere should fail the run before any entity")
    void testRun_LockHeld() {
        try (RunLock ignored = RunLock.acquire(Path.of(properties.getRunLockFile()))) {
            RunReport report = coordinator().run();

            assertEquals(RunStatus.FAILED, report.getStatus());
            assertTrue(report.getEntities().isEmpty());
            assertNotNull(report.getFatalError());
        }
        assertEquals(0, lookups.countRows("dim_donor"));
    }

    @Test
    @DisplayName("A missing source definition should fail the run before any entity")
    void testRun_MissingSourceDefinition() {
        properties.getSources().remove(EntityType.DONOR);

        RunReport report = coordinator().run();

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertTrue(report.getFatalError().contains("DONOR"));
        assertTrue(report.getEntities().isEmpty());
    }

    @Test
    @DisplayName("Preparing an entity should not write to the store")
    void testPrepare_NoWrites() {
        EntityBatch batch = coordinator().prepare(EntityType.DONOR, DimensionLookups.empty(), null);

        assertEquals(3, batch.getAcceptedCount());
        assertEquals(0, lookups.countRows("dim_donor"));
    }
}
