package com.example.conservation.etl;

import com.example.conservation.etl.anomaly.AnomalyDetector;
import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.config.EtlUtilConfig;
import com.example.conservation.etl.conform.CampaignConformer;
import com.example.conservation.etl.conform.ConformanceLayer;
import com.example.conservation.etl.conform.DateDimensionGenerator;
import com.example.conservation.etl.conform.DonationConformer;
import com.example.conservation.etl.conform.DonorConformer;
import com.example.conservation.etl.conform.ElkPopulationConformer;
import com.example.conservation.etl.conform.FinancialFilingConformer;
import com.example.conservation.etl.conform.HabitatConformer;
import com.example.conservation.etl.conform.ProgramServiceLineConformer;
import com.example.conservation.etl.conform.ProjectConformer;
import com.example.conservation.etl.conform.ProjectMetricConformer;
import com.example.conservation.etl.conform.TypeCoercer;
import com.example.conservation.etl.load.JdbcTypeHandler;
import com.example.conservation.etl.load.LookupRepository;
import com.example.conservation.etl.load.StoreLoader;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.SourceType;
import com.example.conservation.etl.quality.DataQualityValidator;
import com.example.conservation.etl.reader.FilingDocumentSourceReader;
import com.example.conservation.etl.reader.LabelProximityStrategy;
import com.example.conservation.etl.reader.SourceReaderFactory;
import com.example.conservation.etl.reader.StructuredDocumentSourceReader;
import com.example.conservation.etl.reader.TabularSourceReader;
import com.example.conservation.etl.service.RunCoordinator;
import com.example.conservation.etl.service.StoreConfigurationVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Shared test wiring: fixture files, an embedded H2 store and a coordinator assembled without Spring.
 */
public final class TestFixtures {

    public static final List<String> FIXTURE_FILES = List.of(
            "donors.csv", "campaigns.csv", "donations.csv", "habitat_areas.json", "conservation_projects.json",
            "filings/rmef_990_2022.txt");

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new EtlUtilConfig().objectMapper();
    }

    public static TypeCoercer coercer() {
        return new TypeCoercer(objectMapper());
    }

    /**
     * Copies the fixture sources into {@code dir}, keeping the filings sub-directory.
     */
    public static Path copyFixtures(Path dir) {
        for (String name : FIXTURE_FILES) {
            Path target = dir.resolve(name);
            try (InputStream in = TestFixtures.class.getResourceAsStream("/fixtures/" + name)) {
                if (in == null) {
                    throw new IllegalStateException("Missing test resource fixtures/" + name);
                }
                Files.createDirectories(target.getParent());
                Files.copy(in, target);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return dir;
    }

    public static Path writeFile(Path dir, String name, String content) {
        try {
            Path file = dir.resolve(name);
            Files.createDirectories(file.getParent());
            return Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Properties whose sources point at the fixture copies in {@code dir}.
     */
    public static EtlProperties properties(Path dir) {
        EtlProperties properties = new EtlProperties();
        properties.setRunLockFile(dir.resolve("etl.lock").toString());
        properties.setReportPath(dir.resolve("run-report.json").toString());
        properties.setReadTimeout(Duration.ofSeconds(30));
        properties.setLoadTimeout(Duration.ofSeconds(30));
        properties.setRunTimeout(Duration.ofMinutes(5));
        properties.setParallelReads(2);

        properties.getSources().put(EntityType.DONOR, source(SourceType.TABULAR, dir.resolve("donors.csv"), null, true, "donor_id"));
        properties.getSources().put(EntityType.CAMPAIGN, source(SourceType.TABULAR, dir.resolve("campaigns.csv"), null, true, "campaign_id"));
        properties.getSources().put(EntityType.DONATION, source(SourceType.TABULAR, dir.resolve("donations.csv"), null, true, "donation_id"));
        properties.getSources().put(EntityType.HABITAT, source(SourceType.STRUCTURED_DOCUMENT, dir.resolve("habitat_areas.json"), null, true));
        properties.getSources().put(EntityType.ELK_POPULATION,
                source(SourceType.STRUCTURED_DOCUMENT, dir.resolve("habitat_areas.json"), "population_counts", false));
        properties.getSources().put(EntityType.PROJECT,
                source(SourceType.STRUCTURED_DOCUMENT, dir.resolve("conservation_projects.json"), null, true));
        properties.getSources().put(EntityType.PROJECT_METRIC,
                source(SourceType.STRUCTURED_DOCUMENT, dir.resolve("conservation_projects.json"), "habitat_ids", true));
        properties.getSources().put(EntityType.FINANCIAL_FILING, source(SourceType.FILING_DOCUMENT, dir.resolve("filings"), null, true));
        properties.getSources().put(EntityType.PROGRAM_SERVICE_LINE,
                source(SourceType.FILING_DOCUMENT, dir.resolve("filings"), "program_services", false));
        return properties;
    }

    public static EtlProperties.SourceConfig source(SourceType type, Path location, String flatten, boolean keepEmpty,
                                                    String... requiredColumns) {
        EtlProperties.SourceConfig config = new EtlProperties.SourceConfig();
        config.setType(type);
        config.setLocation(location.toString());
        config.setFlatten(flatten);
        config.setKeepEmptyFlatten(keepEmpty);
        config.setRequiredColumns(List.of(requiredColumns));
        return config;
    }

    /**
     * A fresh in-memory store with the conservation schema applied.
     */
    public static EmbeddedDatabase embeddedStore() {
        return new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/conservation-schema.sql")
                .build();
    }

    public static StoreLoader storeLoader(DataSource dataSource) {
        return new StoreLoader(new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource),
                new JdbcTypeHandler(), Duration.ofSeconds(30), 500);
    }

    public static SourceReaderFactory readerFactory(EtlProperties properties) {
        ObjectMapper mapper = objectMapper();
        return new SourceReaderFactory(List.of(
                new TabularSourceReader(),
                new StructuredDocumentSourceReader(mapper),
                new FilingDocumentSourceReader(new LabelProximityStrategy(), properties)));
    }

    public static ConformanceLayer conformanceLayer() {
        TypeCoercer coercer = coercer();
        return new ConformanceLayer(List.of(
                new DonorConformer(coercer),
                new CampaignConformer(coercer),
                new HabitatConformer(coercer),
                new ProjectConformer(coercer),
                new DonationConformer(coercer),
                new ElkPopulationConformer(coercer),
                new ProjectMetricConformer(coercer),
                new FinancialFilingConformer(coercer),
                new ProgramServiceLineConformer(coercer)));
    }

    public static ThreadPoolTaskExecutor readerExecutor(int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("test-reader-");
        executor.initialize();
        return executor;
    }

    /**
     * The full pipeline over {@code dataSource}, wired the way the application context wires it.
     */
    public static RunCoordinator coordinator(EtlProperties properties, DataSource dataSource, ThreadPoolTaskExecutor executor) {
        return coordinator(properties, dataSource, executor, readerFactory(properties));
    }

    /**
     * The full pipeline reading through {@code readers}.
     */
    public static RunCoordinator coordinator(EtlProperties properties, DataSource dataSource, ThreadPoolTaskExecutor executor,
                                             SourceReaderFactory readers) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        return new RunCoordinator(
                properties,
                new StoreConfigurationVerifier(dataSource, jdbcTemplate, properties, readers),
                readers,
                conformanceLayer(),
                new DataQualityValidator(properties),
                new AnomalyDetector(properties),
                new DateDimensionGenerator(properties),
                storeLoader(dataSource),
                new LookupRepository(jdbcTemplate),
                executor);
    }
}
