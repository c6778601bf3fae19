package com.example.conservation.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured summary of one pipeline run, consumed by operational tooling.
 */
@Value
@Builder
public class RunReport {
    String runId;
    RunStatus status;
    Instant startedAt;
    Instant finishedAt;
    long elapsedMillis;
    @Singular
    List<EntityOutcome> entities;
    /** Set when the run was aborted before any entity was processed. */
    String fatalError;

    public Map<Severity, Long> getViolationsBySeverity() {
        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        totals.put(Severity.BLOCKING, entities.stream().mapToLong(EntityOutcome::getBlockingViolations).sum());
        totals.put(Severity.WARNING, entities.stream().mapToLong(EntityOutcome::getWarningViolations).sum());
        return totals;
    }

    public Map<String, Long> getAnomaliesByRule() {
        Map<String, Long> totals = new TreeMap<>();
        entities.forEach(outcome -> outcome.getAnomaliesByRule().forEach((rule, count) -> totals.merge(rule, count, Long::sum)));
        return totals;
    }

    public EntityOutcome outcomeFor(EntityType entity) {
        return entities.stream().filter(o -> o.getEntity() == entity).findFirst().orElse(null);
    }

    /**
     * Degraded when any entity failed or was cancelled; failed when nothing succeeded.
     */
    public static RunStatus deriveStatus(List<EntityOutcome> outcomes) {
        if (outcomes.isEmpty() || outcomes.stream().noneMatch(EntityOutcome::isSucceeded)) {
            return RunStatus.FAILED;
        }
        return outcomes.stream().allMatch(EntityOutcome::isSucceeded) ? RunStatus.SUCCESS : RunStatus.DEGRADED;
    }
}
