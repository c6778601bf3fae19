package com.example.conservation.etl.quality;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.util.Optional;
import java.util.function.Function;

/**
 * A required field is null or blank.
 */
public class CompletenessRule<T extends ConformedRecord> extends RecordRule<T> {

    private final String field;
    private final Function<T, Object> getter;

    public CompletenessRule(String field, Function<T, Object> getter) {
        super("required-" + field, ViolationCategory.COMPLETENESS, Severity.BLOCKING);
        this.field = field;
        this.getter = getter;
    }

    @Override
    protected Optional<String> check(T record) {
        Object value = getter.apply(record);
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            return Optional.of("Required field '" + field + "' is empty");
        }
        return Optional.empty();
    }
}
