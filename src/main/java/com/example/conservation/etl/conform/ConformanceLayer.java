package com.example.conservation.etl.conform;

import com.example.conservation.etl.exception.ConformanceException;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.DimensionRecord;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;
import com.example.conservation.etl.model.StagedRecord;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.model.ViolationCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns staged records into typed dimension and fact records. Assigns surrogate keys
 * (the stored key when the lookup has one, otherwise a hash of the natural key) and
 * synthetic fact row ids. A record that fails coercion is excluded and reported as a
 * blocking conformance violation; the rest of the batch carries on.
 */
@Component
public class ConformanceLayer {
    private static final Logger log = LoggerFactory.getLogger(ConformanceLayer.class);

    private final Map<EntityType, EntityConformer<?>> conformers = new EnumMap<>(EntityType.class);

    public ConformanceLayer(List<EntityConformer<?>> conformers) {
        conformers.forEach(c -> this.conformers.put(c.getEntityType(), c));
    }

    public boolean supports(EntityType entityType) {
        return conformers.containsKey(entityType);
    }

    public ConformanceResult conform(EntityType entityType, List<StagedRecord> staged, DimensionLookups lookups) {
        EntityConformer<?> conformer = conformers.get(entityType);
        if (conformer == null) {
            throw new IllegalArgumentException("No conformer registered for " + entityType);
        }
        return run(conformer, staged, lookups);
    }

    private <T extends ConformedRecord> ConformanceResult run(EntityConformer<T> conformer, List<StagedRecord> staged,
                                                              DimensionLookups lookups) {
        EntityType entityType = conformer.getEntityType();
        List<T> records = new ArrayList<>(staged.size());
        List<ValidationResult> violations = new ArrayList<>();

        for (StagedRecord record : staged) {
            T conformed;
            try {
                conformed = conformer.conform(record, lookups);
            } catch (ConformanceException e) {
                log.warn("Excluding {} record {}: {}", entityType, record.getSourceRef(), e.getMessage());
                violations.add(ValidationResult.blocking(entityType, record.getSourceRef(), "type-coercion",
                        ViolationCategory.CONFORMANCE, e.getMessage()));
                continue;
            }
            conformed.setRecordRef(record.getSourceRef());
            assignKeys(conformed, lookups);
            violations.addAll(conformer.warnings(record, conformed));
            records.add(conformed);
        }
        conformer.completeBatch(records);

        log.info("Conformed {} of {} staged {} records", records.size(), staged.size(), entityType);
        return new ConformanceResult(entityType, new ArrayList<>(records), violations);
    }

    private static void assignKeys(ConformedRecord record, DimensionLookups lookups) {
        String naturalKey = record.getNaturalKey();
        if (naturalKey == null) {
            return;
        }
        if (record instanceof DimensionRecord) {
            Long existing = lookups.surrogateKey(record.getEntityType(), naturalKey);
            ((DimensionRecord) record).setSurrogateKey(existing != null
                    ? existing : SurrogateKeyGenerator.keyFor(record.getEntityType(), naturalKey));
        } else if (record instanceof FactRecord) {
            ((FactRecord) record).setRowId(SurrogateKeyGenerator.keyFor(record.getEntityType(), naturalKey));
        }
    }
}
