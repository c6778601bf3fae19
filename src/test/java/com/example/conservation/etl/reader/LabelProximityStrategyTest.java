package com.example.conservation.etl.reader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LabelProximityStrategy Tests")
class LabelProximityStrategyTest {

    private final LabelProximityStrategy strategy = new LabelProximityStrategy();

    @Test
    @DisplayName("Should take the current-year column from the label's line")
    void testFindNumber_LastOnLine() {
        FilingDocument doc = new FilingDocument("f.txt",
                "12  Total revenue - add lines 8 through 11      51,525,335.      55,644,897.\n");

        assertEquals(Optional.of("55,644,897."), strategy.findNumber(doc, List.of("Total revenue")));
    }

    @Test
    @DisplayName("Should match labels ignoring case and extra whitespace")
    void testFindNumber_CaseAndWhitespace() {
        FilingDocument doc = new FilingDocument("f.txt", "TOTAL   EXPENSES.   1,000.   2,000.\n");

        assertEquals(Optional.of("2,000."), strategy.findNumber(doc, List.of("Total expenses")));
    }

    @Test
    @DisplayName("Should keep parenthesised negatives whole")
    void testFindNumber_Negative() {
        FilingDocument doc = new FilingDocument("f.txt", "10  Investment income      311,000.      (45,210)\n");

        assertEquals(Optional.of("(45,210)"), strategy.findNumber(doc, List.of("Investment income")));
    }

    @Test
    @DisplayName("Should read a value wrapped onto the next line")
    void testFindNumber_NextLine() {
        FilingDocument doc = new FilingDocument("f.txt", "Total assets\n\n      85,000,000.\n");

        assertEquals(Optional.of("85,000,000."), strategy.findNumber(doc, List.of("Total assets")));
    }

    @Test
    @DisplayName("Should not borrow a number from a following text line")
    void testFindNumber_NextLineIsText() {
        FilingDocument doc = new FilingDocument("f.txt", "Total assets\nSee schedule 4 for details\n");

        assertEquals(Optional.empty(), strategy.findNumber(doc, List.of("Total assets")));
    }

    @Test
    @DisplayName("Should try alternative labels in order")
    void testFindNumber_Alternatives() {
        FilingDocument doc = new FilingDocument("f.txt", "Salaries and wages   19,250,000.\n");

        assertEquals(Optional.of("19,250,000."),
                strategy.findNumber(doc, List.of("Salaries, other compensation", "Salaries and wages")));
    }

    @Test
    @DisplayName("Should search every page")
    void testFindNumber_LaterPage() {
        FilingDocument doc = new FilingDocument("f.txt", "Part I\fPart X\nTotal liabilities   19,467,403.\n");

        assertEquals(Optional.of("19,467,403."), strategy.findNumber(doc, List.of("Total liabilities")));
    }

    @Test
    @DisplayName("Should return the text after a label")
    void testFindText() {
        FilingDocument doc = new FilingDocument("f.txt", "Name of organization   Rocky Mountain Elk Foundation\n");

        assertEquals(Optional.of("Rocky Mountain Elk Foundation"), strategy.findText(doc, List.of("Name of organization")));
    }

    @Test
    @DisplayName("Should return empty when no label matches")
    void testFindText_Absent() {
        FilingDocument doc = new FilingDocument("f.txt", "Nothing relevant here\n");

        assertTrue(strategy.findText(doc, List.of("Name of organization")).isEmpty());
    }
}
