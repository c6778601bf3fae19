package com.example.conservation.etl.service;

import com.example.conservation.etl.conform.ConformanceResult;
import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.DimensionRecord;
import com.example.conservation.etl.model.EntityOutcome;
import com.example.conservation.etl.model.EntityStatus;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.reader.ExtractionContext;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One entity's records on their way through the pipeline: what was read, what conformance and
 * validation made of it, and the anomalies raised against the accepted records.
 */
@Getter
public class EntityBatch {
    private final EntityType entityType;
    private final ExtractionContext extraction;
    private final ConformanceResult conformance;
    private final List<ValidationResult> validation;
    /** Accepted records of a dimension entity; empty for a fact entity. */
    private final List<DimensionRecord> dimensions;
    /** Accepted records of a fact entity; empty for a dimension entity. */
    private final List<FactRecord> facts;
    private final List<AnomalyFlag> anomalies;
    private final long startedAtMillis;

    private EntityBatch(EntityType entityType, ExtractionContext extraction, ConformanceResult conformance,
                        List<ValidationResult> validation, List<DimensionRecord> dimensions, List<FactRecord> facts,
                        List<AnomalyFlag> anomalies, long startedAtMillis) {
        this.entityType = entityType;
        this.extraction = extraction;
        this.conformance = conformance;
        this.validation = validation;
        this.dimensions = dimensions;
        this.facts = facts;
        this.anomalies = anomalies;
        this.startedAtMillis = startedAtMillis;
    }

    public static EntityBatch ofDimensions(EntityType entityType, ExtractionContext extraction, ConformanceResult conformance,
                                           List<ValidationResult> validation, List<DimensionRecord> accepted,
                                           long startedAtMillis) {
        return new EntityBatch(entityType, extraction, conformance, validation, accepted, List.of(), List.of(),
                startedAtMillis);
    }

    public static EntityBatch ofFacts(EntityType entityType, ExtractionContext extraction, ConformanceResult conformance,
                                      List<ValidationResult> validation, List<FactRecord> accepted,
                                      List<AnomalyFlag> anomalies, long startedAtMillis) {
        return new EntityBatch(entityType, extraction, conformance, validation, List.of(), accepted, anomalies,
                startedAtMillis);
    }

    public int getAcceptedCount() {
        return dimensions.size() + facts.size();
    }

    /** Conformance results first, then validator results. */
    public List<ValidationResult> getAllViolations() {
        List<ValidationResult> all = new ArrayList<>(conformance.getViolations());
        all.addAll(validation);
        return all;
    }

    /**
     * Builds the succeeded outcome for this batch once {@code loaded} rows are committed.
     */
    public EntityOutcome toOutcome(long loaded, int issueSampleSize) {
        List<ValidationResult> violations = getAllViolations();
        long blocking = violations.stream().filter(ValidationResult::isBlocking).count();
        int conformed = conformance.getRecords().size();

        Map<String, Long> anomaliesByRule = new TreeMap<>();
        anomalies.forEach(flag -> anomaliesByRule.merge(flag.getRuleName(), 1L, Long::sum));

        List<String> issues = new ArrayList<>(extraction.getSkippedIssues());
        for (ValidationResult violation : violations) {
            if (issues.size() >= issueSampleSize) {
                break;
            }
            issues.add(violation.toString());
        }
        if (issues.size() > issueSampleSize) {
            issues = issues.subList(0, issueSampleSize);
        }

        return EntityOutcome.builder()
                .entity(entityType)
                .status(EntityStatus.SUCCEEDED)
                .read(extraction.getRecordsRead())
                .skipped(extraction.getRecordsSkipped())
                .conformed(conformed)
                .rejected(conformance.getRejectedCount() + (conformed - getAcceptedCount()))
                .loaded(loaded)
                .blockingViolations(blocking)
                .warningViolations(violations.size() - blocking)
                .anomaliesByRule(anomaliesByRule)
                .issues(issues)
                .elapsedMillis(System.currentTimeMillis() - startedAtMillis)
                .build();
    }

    /**
     * The outcome of a batch whose load failed: nothing loaded, every count of the batch kept.
     */
    public EntityOutcome toFailedOutcome(String error, int issueSampleSize) {
        return toOutcome(0, issueSampleSize).toBuilder()
                .status(EntityStatus.FAILED)
                .error(error)
                .build();
    }
}
