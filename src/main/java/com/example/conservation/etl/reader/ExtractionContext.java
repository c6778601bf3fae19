package com.example.conservation.etl.reader;

import com.example.conservation.etl.exception.SourceReadException;
import com.example.conservation.etl.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds counters for a single entity's extraction. Shared between the reader
 * and the run coordinator; readers for different entities never share one.
 */
public class ExtractionContext {
    private static final Logger log = LoggerFactory.getLogger(ExtractionContext.class);

    private final EntityType entityType;
    private final int issueSampleSize;
    private final AtomicLong recordsRead = new AtomicLong(0);
    private final AtomicLong recordsSkipped = new AtomicLong(0);
    private final List<String> skippedIssues = Collections.synchronizedList(new ArrayList<>());

    public ExtractionContext(EntityType entityType, int issueSampleSize) {
        this.entityType = entityType;
        this.issueSampleSize = issueSampleSize;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public long incrementAndGetRecordsRead() {
        return recordsRead.incrementAndGet();
    }

    public long getRecordsRead() {
        return recordsRead.get();
    }

    /**
     * Records a row-level read failure. The row is dropped and extraction continues.
     */
    public void recordSkipped(SourceReadException e) {
        recordsSkipped.incrementAndGet();
        log.warn("Skipping {} row {}: {}", entityType, e.getSourceRef(), e.getMessage());
        if (skippedIssues.size() < issueSampleSize) {
            skippedIssues.add(e.getSourceRef() + ": " + e.getMessage());
        }
    }

    public long getRecordsSkipped() {
        return recordsSkipped.get();
    }

    public List<String> getSkippedIssues() {
        synchronized (skippedIssues) {
            return List.copyOf(skippedIssues);
        }
    }
}
