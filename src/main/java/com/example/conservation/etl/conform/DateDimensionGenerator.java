package com.example.conservation.etl.conform;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.model.DateDimension;
import com.example.conservation.etl.model.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds one date row per calendar day across the observed business dates, inclusive.
 * The fiscal year is named after the calendar year in which it ends.
 */
@Component
public class DateDimensionGenerator {
    private static final Logger log = LoggerFactory.getLogger(DateDimensionGenerator.class);

    private final int fiscalYearStartMonth;

    @Autowired
    public DateDimensionGenerator(EtlProperties properties) {
        this(properties.getFiscalYearStartMonth());
    }

    public DateDimensionGenerator(int fiscalYearStartMonth) {
        if (fiscalYearStartMonth < 1 || fiscalYearStartMonth > 12) {
            throw new IllegalArgumentException("Fiscal year start month must be 1-12, got " + fiscalYearStartMonth);
        }
        this.fiscalYearStartMonth = fiscalYearStartMonth;
    }

    /**
     * @param facts      Accepted fact records of every fact entity.
     * @param extraDates Further dates to cover, e.g. the stored range of a fact table that failed this run.
     * @return Date rows from the earliest to the latest date, or an empty list when there are none.
     */
    public List<DateDimension> generate(Collection<? extends FactRecord> facts, Collection<LocalDate> extraDates) {
        LocalDate min = null;
        LocalDate max = null;
        List<LocalDate> observed = new ArrayList<>(extraDates);
        facts.stream().map(FactRecord::getBusinessDate).filter(Objects::nonNull).forEach(observed::add);
        for (LocalDate date : observed) {
            if (min == null || date.isBefore(min)) {
                min = date;
            }
            if (max == null || date.isAfter(max)) {
                max = date;
            }
        }
        if (min == null) {
            log.info("No business dates observed; date dimension will be empty");
            return List.of();
        }
        return generate(min, max);
    }

    public List<DateDimension> generate(LocalDate from, LocalDate to) {
        List<DateDimension> rows = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            rows.add(toRow(day));
        }
        log.info("Generated {} date rows from {} to {}", rows.size(), from, to);
        return rows;
    }

    DateDimension toRow(LocalDate day) {
        DateDimension row = new DateDimension();
        row.setFullDate(day);
        row.setSurrogateKey(FactRecord.toDateKey(day));
        row.setRecordRef("generated#" + day);
        row.setCalendarYear(day.getYear());
        row.setCalendarQuarter((day.getMonthValue() - 1) / 3 + 1);
        row.setCalendarMonth(day.getMonthValue());
        row.setMonthName(day.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        row.setIsoWeek(day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        row.setDayOfMonth(day.getDayOfMonth());
        row.setDayOfWeek(day.getDayOfWeek().getValue());
        row.setDayName(day.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        row.setWeekend(day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY);

        int monthsIntoFiscalYear = Math.floorMod(day.getMonthValue() - fiscalYearStartMonth, 12);
        boolean startsPreviousCalendarYear = fiscalYearStartMonth > 1 && day.getMonthValue() >= fiscalYearStartMonth;
        row.setFiscalYear(startsPreviousCalendarYear ? day.getYear() + 1 : day.getYear());
        row.setFiscalQuarter(monthsIntoFiscalYear / 3 + 1);
        return row;
    }
}
