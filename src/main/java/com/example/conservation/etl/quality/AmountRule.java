package com.example.conservation.etl.quality;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * A measure must be non-negative, or strictly positive. Null measures pass; completeness covers them.
 */
public class AmountRule<T extends ConformedRecord> extends RecordRule<T> {

    private final String field;
    private final Function<T, ? extends Number> getter;
    private final boolean strictlyPositive;

    private AmountRule(String field, Function<T, ? extends Number> getter, boolean strictlyPositive) {
        super((strictlyPositive ? "positive-" : "non-negative-") + field, ViolationCategory.BUSINESS_RULE, Severity.BLOCKING);
        this.field = field;
        this.getter = getter;
        this.strictlyPositive = strictlyPositive;
    }

    public static <T extends ConformedRecord> AmountRule<T> positive(String field, Function<T, ? extends Number> getter) {
        return new AmountRule<>(field, getter, true);
    }

    public static <T extends ConformedRecord> AmountRule<T> nonNegative(String field, Function<T, ? extends Number> getter) {
        return new AmountRule<>(field, getter, false);
    }

    @Override
    protected Optional<String> check(T record) {
        Number value = getter.apply(record);
        if (value == null) {
            return Optional.empty();
        }
        int sign = new BigDecimal(value.toString()).signum();
        if (sign < 0 || (strictlyPositive && sign == 0)) {
            return Optional.of(field + " must be " + (strictlyPositive ? "positive" : "non-negative") + ", was " + value);
        }
        return Optional.empty();
    }
}
