package com.example.conservation.etl.service;

import com.example.conservation.etl.anomaly.AnomalyContext;
import com.example.conservation.etl.anomaly.AnomalyDetector;
import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.conform.ConformanceLayer;
import com.example.conservation.etl.conform.ConformanceResult;
import com.example.conservation.etl.conform.DateDimensionGenerator;
import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.exception.FatalConfigurationException;
import com.example.conservation.etl.exception.RunCancelledException;
import com.example.conservation.etl.exception.RunLockException;
import com.example.conservation.etl.load.LookupRepository;
import com.example.conservation.etl.load.StoreLoader;
import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.DateDimension;
import com.example.conservation.etl.model.DimensionRecord;
import com.example.conservation.etl.model.EntityOutcome;
import com.example.conservation.etl.model.EntityStatus;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;
import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.model.RunStatus;
import com.example.conservation.etl.model.StagedRecord;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.quality.DataQualityValidator;
import com.example.conservation.etl.reader.ExtractionContext;
import com.example.conservation.etl.reader.SourceReaderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives one end-to-end run:
 * verify configuration, take the run lock, extract and load the dimensions, refresh the key
 * lookups, extract the facts, regenerate the date dimension, load the facts and report.
 * <p>
 * Every entity ends with an {@link EntityOutcome}; an exception raised while processing one
 * entity is converted into that entity's outcome and never reaches another entity.
 * Cancellation and the run deadline are checked at entity boundaries.
 */
@Service
public class RunCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    public static final String MDC_RUN_ID = "runId";

    private final EtlProperties properties;
    private final StoreConfigurationVerifier verifier;
    private final SourceReaderFactory readerFactory;
    private final ConformanceLayer conformanceLayer;
    private final DataQualityValidator validator;
    private final AnomalyDetector anomalyDetector;
    private final DateDimensionGenerator dateDimensionGenerator;
    private final StoreLoader storeLoader;
    private final LookupRepository lookupRepository;
    private final AsyncTaskExecutor readerTaskExecutor;

    private final AtomicBoolean cancellationRequested = new AtomicBoolean();
    private volatile RunReport lastReport;

    public RunCoordinator(EtlProperties properties,
                          StoreConfigurationVerifier verifier,
                          SourceReaderFactory readerFactory,
                          ConformanceLayer conformanceLayer,
                          DataQualityValidator validator,
                          AnomalyDetector anomalyDetector,
                          DateDimensionGenerator dateDimensionGenerator,
                          StoreLoader storeLoader,
                          LookupRepository lookupRepository,
                          @Qualifier("readerTaskExecutor") AsyncTaskExecutor readerTaskExecutor) {
        this.properties = properties;
        this.verifier = verifier;
        this.readerFactory = readerFactory;
        this.conformanceLayer = conformanceLayer;
        this.validator = validator;
        this.anomalyDetector = anomalyDetector;
        this.dateDimensionGenerator = dateDimensionGenerator;
        this.storeLoader = storeLoader;
        this.lookupRepository = lookupRepository;
        this.readerTaskExecutor = readerTaskExecutor;
    }

    /**
     * Asks the current run to stop. Entities not yet started are marked cancelled; the entity
     * being loaded rolls back its transaction.
     */
    public void requestCancellation() {
        if (cancellationRequested.compareAndSet(false, true)) {
            log.warn("Cancellation requested");
        }
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    /**
     * Report of the most recent run, or null before the first run.
     */
    public RunReport getLastReport() {
        return lastReport;
    }

    public RunReport run() {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        Instant startedAt = Instant.now();
        log.info("Starting conservation ETL run {}", runId);
        try {
            RunReport report;
            try {
                verifier.verify();
                try (RunLock ignored = RunLock.acquire(Path.of(properties.getRunLockFile()))) {
                    List<EntityOutcome> outcomes = execute(startedAt.plus(properties.getRunTimeout()));
                    report = buildReport(runId, startedAt, RunReport.deriveStatus(outcomes), outcomes, null);
                }
            } catch (FatalConfigurationException | RunLockException e) {
                log.error("Run {} aborted before processing any entity: {}", runId, e.getMessage(), e);
                report = buildReport(runId, startedAt, RunStatus.FAILED, List.of(), e.getMessage());
            }
            lastReport = report;
            log.info("Run {} finished with status {} in {} ms", runId, report.getStatus(), report.getElapsedMillis());
            return report;
        } finally {
            cancellationRequested.set(false);
            MDC.remove(MDC_RUN_ID);
        }
    }

    private List<EntityOutcome> execute(Instant deadline) {
        Map<EntityType, EntityOutcome> outcomes = new EnumMap<>(EntityType.class);

        // Dimensions: extraction in parallel, loads one at a time in load order.
        DimensionLookups lookups = lookupRepository.loadLookups();
        List<EntityType> dimensions = sourced(true);
        Map<EntityType, Future<EntityBatch>> pending = new EnumMap<>(EntityType.class);
        for (EntityType dimension : dimensions) {
            if (!mayStart(dimension, deadline, outcomes)) {
                continue;
            }
            DimensionLookups current = lookups;
            pending.put(dimension, readerTaskExecutor.submit(withRunId(() -> prepare(dimension, current, null))));
        }
        for (EntityType dimension : dimensions) {
            Future<EntityBatch> future = pending.get(dimension);
            if (future == null) {
                continue;
            }
            EntityBatch batch = await(dimension, future, outcomes);
            if (batch == null) {
                continue;
            }
            if (isCancellationRequested()) {
                outcomes.put(dimension, EntityOutcome.cancelled(dimension));
                continue;
            }
            outcomes.put(dimension, loadDimension(batch));
        }

        // Facts resolve against what the store now holds.
        lookups = lookupRepository.loadLookups();
        AnomalyContext anomalyContext = new AnomalyContext(lookupRepository.habitatStatuses());
        List<EntityBatch> factBatches = new ArrayList<>();
        for (EntityType fact : sourced(false)) {
            if (!mayStart(fact, deadline, outcomes)) {
                continue;
            }
            DimensionLookups current = lookups;
            Future<EntityBatch> future = readerTaskExecutor.submit(withRunId(() -> prepare(fact, current, anomalyContext)));
            EntityBatch batch = await(fact, future, outcomes);
            if (batch != null) {
                factBatches.add(batch);
            }
        }

        if (factBatches.isEmpty()) {
            log.warn("No fact entity was extracted; keeping the stored date dimension");
        } else if (mayStart(EntityType.DATE, deadline, outcomes)) {
            outcomes.put(EntityType.DATE, loadDateDimension(factBatches));
        }

        for (EntityBatch batch : factBatches) {
            EntityType fact = batch.getEntityType();
            if (mayStart(fact, deadline, outcomes)) {
                outcomes.put(fact, loadFacts(batch));
            }
        }

        List<EntityOutcome> ordered = new ArrayList<>();
        for (EntityType entity : EntityType.values()) {
            EntityOutcome outcome = outcomes.get(entity);
            if (outcome != null) {
                ordered.add(outcome);
            }
        }
        return ordered;
    }

    /**
     * Read, conform, validate and, for facts, detect anomalies. Nothing is written to the store.
     */
    EntityBatch prepare(EntityType entity, DimensionLookups lookups, AnomalyContext anomalyContext) {
        long started = System.currentTimeMillis();
        ExtractionContext extraction = new ExtractionContext(entity, properties.getReportViolationSampleSize());
        List<StagedRecord> staged;
        try (Stream<StagedRecord> records = readerFactory.open(properties.sourceFor(entity), extraction)) {
            staged = records.collect(Collectors.toList());
        }
        log.info("Extracted {} {} records ({} skipped)", staged.size(), entity, extraction.getRecordsSkipped());

        ConformanceResult conformance = conformanceLayer.conform(entity, staged, lookups);
        List<ValidationResult> validation = validator.validate(entity, conformance.getRecords(), lookups);
        List<ConformedRecord> accepted = DataQualityValidator.accepted(conformance.getRecords(), validation);

        List<AnomalyFlag> anomalies = Collections.emptyList();
        if (entity.isFact()) {
            List<FactRecord> facts = accepted.stream().map(FactRecord.class::cast).collect(Collectors.toList());
            anomalies = anomalyDetector.detect(entity, facts, anomalyContext == null ? AnomalyContext.empty() : anomalyContext);
            return EntityBatch.ofFacts(entity, extraction, conformance, validation, facts, anomalies, started);
        }
        List<DimensionRecord> dimensions = accepted.stream().map(DimensionRecord.class::cast).collect(Collectors.toList());
        return EntityBatch.ofDimensions(entity, extraction, conformance, validation, dimensions, started);
    }

    private EntityOutcome loadDimension(EntityBatch batch) {
        EntityType entity = batch.getEntityType();
        try {
            int loaded = storeLoader.upsertDimension(entity, batch.getDimensions(), this::isCancellationRequested);
            return report(batch.toOutcome(loaded, properties.getReportViolationSampleSize()));
        } catch (RunCancelledException e) {
            return EntityOutcome.cancelled(entity);
        } catch (RuntimeException e) {
            return failed(batch, e);
        }
    }

    private EntityOutcome loadFacts(EntityBatch batch) {
        EntityType entity = batch.getEntityType();
        try {
            int loaded = storeLoader.replaceFacts(entity, batch.getFacts(), batch.getAnomalies(), this::isCancellationRequested);
            return report(batch.toOutcome(loaded, properties.getReportViolationSampleSize()));
        } catch (RunCancelledException e) {
            return EntityOutcome.cancelled(entity);
        } catch (RuntimeException e) {
            return failed(batch, e);
        }
    }

    /**
     * Covers every business date of this run's facts plus those of facts already stored, so
     * fact tables that were not reloaded keep their dates.
     */
    private EntityOutcome loadDateDimension(List<EntityBatch> factBatches) {
        long started = System.currentTimeMillis();
        try {
            List<FactRecord> facts = new ArrayList<>();
            for (EntityBatch batch : factBatches) {
                facts.addAll(batch.getFacts());
            }
            List<LocalDate> storedDates = lookupRepository.referencedDates();
            List<DateDimension> rows = dateDimensionGenerator.generate(facts, storedDates);
            int loaded = storeLoader.replaceDateDimension(rows, this::isCancellationRequested);
            return report(EntityOutcome.builder()
                    .entity(EntityType.DATE)
                    .status(EntityStatus.SUCCEEDED)
                    .conformed(rows.size())
                    .loaded(loaded)
                    .elapsedMillis(System.currentTimeMillis() - started)
                    .build());
        } catch (RunCancelledException e) {
            return EntityOutcome.cancelled(EntityType.DATE);
        } catch (RuntimeException e) {
            return failed(EntityType.DATE, e, started);
        }
    }

    private EntityBatch await(EntityType entity, Future<EntityBatch> future, Map<EntityType, EntityOutcome> outcomes) {
        long started = System.currentTimeMillis();
        Duration timeout = properties.getReadTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Extraction of {} did not finish within {}", entity, timeout);
            outcomes.put(entity, EntityOutcome.failed(entity, "Extraction timed out after " + timeout,
                    System.currentTimeMillis() - started));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            outcomes.put(entity, failed(entity, cause, started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            requestCancellation();
            outcomes.put(entity, EntityOutcome.cancelled(entity));
        }
        return null;
    }

    /**
     * Records a cancelled or failed outcome and returns false when the entity must not start.
     */
    private boolean mayStart(EntityType entity, Instant deadline, Map<EntityType, EntityOutcome> outcomes) {
        if (isCancellationRequested()) {
            outcomes.put(entity, EntityOutcome.cancelled(entity));
            return false;
        }
        if (Instant.now().isAfter(deadline)) {
            log.error("Run timeout of {} reached before {} started", properties.getRunTimeout(), entity);
            outcomes.put(entity, EntityOutcome.failed(entity, "Run timeout reached before the entity started", 0));
            return false;
        }
        return true;
    }

    private <T> Callable<T> withRunId(Callable<T> task) {
        String runId = MDC.get(MDC_RUN_ID);
        return () -> {
            MDC.put(MDC_RUN_ID, runId);
            try {
                return task.call();
            } finally {
                MDC.remove(MDC_RUN_ID);
            }
        };
    }

    private static List<EntityType> sourced(boolean dimensions) {
        List<EntityType> entities = new ArrayList<>();
        for (EntityType entity : EntityType.values()) {
            if (entity.isSourced() && entity.isDimension() == dimensions) {
                entities.add(entity);
            }
        }
        return entities;
    }

    private static EntityOutcome failed(EntityType entity, Throwable error, long startedAtMillis) {
        log.error("{} failed: {}", entity, error.getMessage(), error);
        return EntityOutcome.failed(entity, messageOf(error), System.currentTimeMillis() - startedAtMillis);
    }

    /**
     * A load failure keeps what was read, rejected and flagged in the batch.
     */
    private EntityOutcome failed(EntityBatch batch, Throwable error) {
        log.error("{} failed: {}", batch.getEntityType(), error.getMessage(), error);
        EntityOutcome outcome = batch.toFailedOutcome(messageOf(error), properties.getReportViolationSampleSize());
        log.info("{} failed after read={} rejected={} blocking={} anomalies={}", outcome.getEntity(), outcome.getRead(),
                outcome.getRejected(), outcome.getBlockingViolations(), outcome.getAnomaliesByRule());
        return outcome;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static EntityOutcome report(EntityOutcome outcome) {
        log.info("{} succeeded: read={} skipped={} conformed={} rejected={} loaded={} blocking={} warnings={} anomalies={}",
                outcome.getEntity(), outcome.getRead(), outcome.getSkipped(), outcome.getConformed(), outcome.getRejected(),
                outcome.getLoaded(), outcome.getBlockingViolations(), outcome.getWarningViolations(), outcome.getAnomaliesByRule());
        return outcome;
    }

    private static RunReport buildReport(String runId, Instant startedAt, RunStatus status, List<EntityOutcome> outcomes,
                                         String fatalError) {
        Instant finishedAt = Instant.now();
        return RunReport.builder()
                .runId(runId)
                .status(status)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .elapsedMillis(Duration.between(startedAt, finishedAt).toMillis())
                .entities(outcomes)
                .fatalError(fatalError)
                .build();
    }
}
