package com.example.conservation.etl.quality;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Non-blocking plausibility check: the record still loads, the finding is reported.
 */
public class WarningRule<T extends ConformedRecord> extends RecordRule<T> {

    private final Predicate<T> suspicious;
    private final Function<T, String> message;

    public WarningRule(String ruleName, Predicate<T> suspicious, Function<T, String> message) {
        super(ruleName, ViolationCategory.BUSINESS_RULE, Severity.WARNING);
        this.suspicious = suspicious;
        this.message = message;
    }

    @Override
    protected Optional<String> check(T record) {
        return suspicious.test(record) ? Optional.of(message.apply(record)) : Optional.empty();
    }
}
