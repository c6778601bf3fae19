package com.example.conservation.etl.quality;

import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.model.ViolationCategory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The first record with a natural key wins; every later one with the same key is blocked.
 */
public class UniquenessRule<T extends ConformedRecord> implements ValidationRule<T> {

    @Override
    public String getRuleName() {
        return "unique-natural-key";
    }

    @Override
    public List<ValidationResult> evaluate(List<T> batch, DimensionLookups lookups) {
        Map<String, String> firstSeen = new HashMap<>();
        List<ValidationResult> results = new ArrayList<>();
        for (T record : batch) {
            String key = record.getNaturalKey();
            if (key == null) {
                continue;
            }
            String first = firstSeen.putIfAbsent(key, record.getRecordRef());
            if (first != null) {
                results.add(ValidationResult.blocking(record.getEntityType(), record.getRecordRef(), getRuleName(),
                        ViolationCategory.UNIQUENESS,
                        "Duplicate natural key '" + key + "', first seen at " + first));
            }
        }
        return results;
    }
}
