package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rule over one fact entity's accepted records.
 *
 * @param <T> The fact type inspected.
 */
public interface AnomalyRule<T extends FactRecord> {

    String getRuleName();

    EntityType getEntityType();

    Class<T> getRecordType();

    List<AnomalyFlag> detect(List<T> batch, AnomalyContext context);

    /**
     * Runs the rule over a batch of its entity, viewed as the rule's record type.
     */
    default List<AnomalyFlag> detectIn(List<? extends FactRecord> batch, AnomalyContext context) {
        List<T> records = new ArrayList<>(batch.size());
        for (FactRecord record : batch) {
            records.add(getRecordType().cast(record));
        }
        return detect(records, context);
    }
}
