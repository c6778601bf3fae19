package com.example.conservation.etl.service;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.exception.EtlException;
import com.example.conservation.etl.model.EntityOutcome;
import com.example.conservation.etl.model.RunReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the run report as JSON to the configured report path and logs a summary.
 */
@Component
public class RunReportPublisher {
    private static final Logger log = LoggerFactory.getLogger(RunReportPublisher.class);

    private final ObjectMapper objectMapper;
    private final EtlProperties properties;

    public RunReportPublisher(ObjectMapper objectMapper, EtlProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Path publish(RunReport report) {
        Path target = Path.of(properties.getReportPath());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        } catch (IOException e) {
            log.error("Failed to write run report {} to {}: {}", report.getRunId(), target, e.getMessage(), e);
            throw new EtlException("Cannot write run report to " + target, e);
        }

        log.info("Run {} status={} elapsed={}ms violations={} anomalies={} report={}", report.getRunId(), report.getStatus(),
                report.getElapsedMillis(), report.getViolationsBySeverity(), report.getAnomaliesByRule(), target);
        for (EntityOutcome outcome : report.getEntities()) {
            if (outcome.isSucceeded()) {
                log.info("  {} {} read={} skipped={} conformed={} rejected={} loaded={}", outcome.getEntity(), outcome.getStatus(),
                        outcome.getRead(), outcome.getSkipped(), outcome.getConformed(), outcome.getRejected(), outcome.getLoaded());
            } else {
                log.warn("  {} {}: {}", outcome.getEntity(), outcome.getStatus(), outcome.getError());
            }
        }
        if (report.getFatalError() != null) {
            log.error("  Run aborted: {}", report.getFatalError());
        }
        return target;
    }
}
