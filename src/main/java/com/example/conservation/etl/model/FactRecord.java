package com.example.conservation.etl.model;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Getter
@Setter
public abstract class FactRecord extends ConformedRecord {

    private static final DateTimeFormatter DATE_KEY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    /** Synthetic row id, derived from the natural key so reloads produce identical rows. */
    private long rowId;

    private LocalDate businessDate;

    /**
     * Dimension references of this fact. The date dimension is not listed here;
     * it is generated to cover every business date.
     */
    public abstract List<ForeignKeyRef> getForeignKeys();

    /** yyyyMMdd smart key of the business date, or null when the date is unknown. */
    public Integer getDateKey() {
        return businessDate == null ? null : toDateKey(businessDate);
    }

    public static int toDateKey(LocalDate date) {
        return Integer.parseInt(date.format(DATE_KEY_FORMAT));
    }
}
