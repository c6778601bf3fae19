package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.DateDimension;
import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.FactRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateDimensionGenerator Tests")
class DateDimensionGeneratorTest {

    private final DateDimensionGenerator generator = new DateDimensionGenerator(10);

    private static FactRecord donationOn(LocalDate date) {
        DonationFact donation = new DonationFact();
        donation.setBusinessDate(date);
        return donation;
    }

    @Test
    @DisplayName("Should cover every day between the earliest and latest business date")
    void testGenerate_Range() {
        List<DateDimension> rows = generator.generate(
                List.of(donationOn(LocalDate.of(2023, 3, 1)), donationOn(null)),
                List.of(LocalDate.of(2023, 2, 27)));

        assertEquals(3, rows.size());
        assertEquals(LocalDate.of(2023, 2, 27), rows.get(0).getFullDate());
        assertEquals(LocalDate.of(2023, 3, 1), rows.get(2).getFullDate());
        assertEquals(20230228, rows.get(1).getDateKey());
    }

    @Test
    @DisplayName("Should produce nothing when no business date is known")
    void testGenerate_Empty() {
        assertTrue(generator.generate(List.of(donationOn(null)), List.of()).isEmpty());
    }

    @Test
    @DisplayName("Should fill calendar attributes")
    void testToRow_Calendar() {
        DateDimension row = generator.toRow(LocalDate.of(2023, 12, 31));

        assertEquals(20231231, row.getDateKey());
        assertEquals(2023, row.getCalendarYear());
        assertEquals(4, row.getCalendarQuarter());
        assertEquals("December", row.getMonthName());
        assertEquals("Sunday", row.getDayName());
        assertEquals(7, row.getDayOfWeek());
        assertTrue(row.isWeekend());
        assertEquals(52, row.getIsoWeek());
    }

    @ParameterizedTest
    @CsvSource({
            "2022-10-01, 2023, 1",
            "2022-12-31, 2023, 1",
            "2023-01-01, 2023, 2",
            "2023-06-30, 2023, 3",
            "2023-09-30, 2023, 4"
    })
    @DisplayName("Fiscal year starting in October should be named after its ending year")
    void testToRow_FiscalYear(String date, int fiscalYear, int fiscalQuarter) {
        DateDimension row = generator.toRow(LocalDate.parse(date));

        assertEquals(fiscalYear, row.getFiscalYear());
        assertEquals(fiscalQuarter, row.getFiscalQuarter());
    }

    @Test
    @DisplayName("Fiscal year starting in January should match the calendar year")
    void testToRow_CalendarFiscalYear() {
        DateDimension row = new DateDimensionGenerator(1).toRow(LocalDate.of(2023, 11, 5));

        assertEquals(2023, row.getFiscalYear());
        assertEquals(4, row.getFiscalQuarter());
    }

    @Test
    @DisplayName("Should reject an invalid fiscal start month")
    void testConstructor_InvalidMonth() {
        assertThrows(IllegalArgumentException.class, () -> new DateDimensionGenerator(13));
    }
}
