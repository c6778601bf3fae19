package com.example.conservation.etl.load;

import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.DonorDimension;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.sql.Types;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableDefinitions Tests")
class TableDefinitionsTest {

    // ============================================================================
    // Column sizes
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "9999999999999999.99, true",
            "9999999999999999.994, true",
            "9999999999999999.995, false",
            "123456789012345678901.00, false",
            "-0.001, true"
    })
    @DisplayName("Should compare decimals to DECIMAL(18, 2) after rounding to two places")
    void testDescribeMisfit_Decimal(String amount, boolean fits) {
        ColumnDefinition<DonationFact> column = new ColumnDefinition<>("amount", Types.DECIMAL, 18, 2, false, DonationFact::getAmount);
        DonationFact donation = new DonationFact();
        donation.setAmount(new BigDecimal(amount));

        assertEquals(fits, column.describeMisfit(donation) == null);
    }

    @Test
    @DisplayName("Should report text longer than the column and ignore unsized columns")
    void testDescribeMisfit_Text() {
        DonorDimension donor = new DonorDimension();
        donor.setState("Montana");

        assertEquals("state is 7 characters long; the column holds 2",
                new ColumnDefinition<DonorDimension>("state", Types.VARCHAR, 2, true, DonorDimension::getState).describeMisfit(donor));
        assertNull(new ColumnDefinition<DonorDimension>("state", Types.VARCHAR, 32, true, DonorDimension::getState).describeMisfit(donor));
        assertNull(new ColumnDefinition<DonorDimension>("state", Types.VARCHAR, true, DonorDimension::getState).describeMisfit(donor));
    }

    @Test
    @DisplayName("The population change column should hold a twenty-million-fold increase")
    void testMisfits_PopulationChangePct() {
        TableDefinition<?> table = TableDefinitions.forEntity(EntityType.ELK_POPULATION);
        ElkPopulationFact observation = new ElkPopulationFact();
        observation.setHabitatId("H001");
        observation.setObservationYear(2023);
        observation.setElkCount(20_000_000);
        observation.setPopulationChangePct(new BigDecimal("1999999900.00"));

        assertTrue(table.misfits(observation).isEmpty());
    }

    // ============================================================================
    // Record typing
    // ============================================================================

    @Test
    @DisplayName("Should view records as the table's record type and refuse others")
    void testTyped() {
        TableDefinition<?> table = TableDefinitions.forEntity(EntityType.DONATION);
        DonationFact donation = new DonationFact();

        assertEquals(DonationFact.class, table.getRecordType());
        assertEquals(List.of(donation), table.typed(List.of(donation)));
        assertThrows(ClassCastException.class, () -> table.typed(List.of(new DonorDimension())));
    }
}
