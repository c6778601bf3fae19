package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;

/**
 * One calendar day. The surrogate key is the yyyyMMdd date key.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class DateDimension extends DimensionRecord {
    private LocalDate fullDate;
    private int calendarYear;
    private int calendarQuarter;
    private int calendarMonth;
    private String monthName;
    private int isoWeek;
    private int dayOfMonth;
    private int dayOfWeek; // 1 = Monday
    private String dayName;
    private boolean weekend;
    private int fiscalYear;
    private int fiscalQuarter;

    @Override
    public EntityType getEntityType() {
        return EntityType.DATE;
    }

    @Override
    public String getNaturalKey() {
        return fullDate == null ? null : fullDate.toString();
    }

    public int getDateKey() {
        return (int) getSurrogateKey();
    }
}
