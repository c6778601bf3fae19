package com.example.conservation.etl.quality;

import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Function;

/**
 * End date must not precede start date. Records missing either date pass.
 */
public class DateOrderRule<T extends ConformedRecord> extends RecordRule<T> {

    private final Function<T, LocalDate> start;
    private final Function<T, LocalDate> end;

    public DateOrderRule(Function<T, LocalDate> start, Function<T, LocalDate> end) {
        super("end-not-before-start", ViolationCategory.BUSINESS_RULE, Severity.BLOCKING);
        this.start = start;
        this.end = end;
    }

    @Override
    protected Optional<String> check(T record) {
        LocalDate from = start.apply(record);
        LocalDate to = end.apply(record);
        if (from != null && to != null && to.isBefore(from)) {
            return Optional.of("end_date " + to + " is before start_date " + from);
        }
        return Optional.empty();
    }
}
