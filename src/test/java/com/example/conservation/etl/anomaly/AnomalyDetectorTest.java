package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ProjectMetricFact;
import com.example.conservation.etl.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetector Tests")
class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector(new EtlProperties());

    private static DonationFact donation(String id, String amount) {
        DonationFact donation = new DonationFact();
        donation.setDonationId(id);
        donation.setDonorId("D001");
        donation.setAmount(new BigDecimal(amount));
        return donation;
    }

    private static ElkPopulationFact observation(String habitat, int year, int count, String changePct) {
        ElkPopulationFact observation = new ElkPopulationFact();
        observation.setHabitatId(habitat);
        observation.setObservationYear(year);
        observation.setElkCount(count);
        observation.setPopulationChangePct(changePct == null ? null : new BigDecimal(changePct));
        return observation;
    }

    @Test
    @DisplayName("Should flag donations above the threshold only")
    void testDetect_LargeDonation() {
        List<AnomalyFlag> flags = detector.detect(EntityType.DONATION,
                List.of(donation("DN001", "250.00"), donation("DN002", "15000.00"), donation("DN003", "10000")),
                AnomalyContext.empty());

        assertEquals(1, flags.size());
        AnomalyFlag flag = flags.get(0);
        assertEquals("DN002", flag.getRecordKey());
        assertEquals("large-donation", flag.getRuleName());
        assertEquals(Severity.WARNING, flag.getSeverity());
        assertEquals(new BigDecimal("15000.00"), flag.getObservedValue());
        assertEquals(new BigDecimal("10000"), flag.getThreshold());
    }

    @Test
    @DisplayName("Should flag a population decline beyond the configured percentage")
    void testDetect_PopulationDecline() {
        List<AnomalyFlag> flags = detector.detect(EntityType.ELK_POPULATION, List.of(
                observation("H001", 2021, 500, null),
                observation("H001", 2022, 400, "-20.00"),
                observation("H004", 2022, 95, "-5.00")), AnomalyContext.empty());

        assertEquals(1, flags.size());
        assertEquals("population-decline", flags.get(0).getRuleName());
        assertEquals("H001|2022", flags.get(0).getRecordKey());
        assertEquals(new BigDecimal("-10"), flags.get(0).getThreshold());
    }

    @Test
    @DisplayName("Should flag the latest observation of an at-risk habitat")
    void testDetect_HabitatAtRisk() {
        AnomalyContext context = new AnomalyContext(Map.of("H002", "at risk", "H001", "Stable"));

        List<AnomalyFlag> flags = detector.detect(EntityType.ELK_POPULATION, List.of(
                observation("H002", 2023, 310, "3.33"),
                observation("H002", 2022, 300, null),
                observation("H001", 2022, 480, "-4.00")), context);

        assertEquals(1, flags.size());
        assertEquals("habitat-at-risk", flags.get(0).getRuleName());
        assertEquals("H002|2023", flags.get(0).getRecordKey());
    }

    @Test
    @DisplayName("Should flag projects spending more than their budget")
    void testDetect_BudgetOverrun() {
        ProjectMetricFact over = new ProjectMetricFact();
        over.setProjectId("P001");
        over.setHabitatId("H001");
        over.setBudget(new BigDecimal("250000"));
        over.setSpentToDate(new BigDecimal("300000"));
        ProjectMetricFact within = new ProjectMetricFact();
        within.setProjectId("P002");
        within.setBudget(new BigDecimal("100000"));
        within.setSpentToDate(new BigDecimal("20000"));

        List<AnomalyFlag> flags = detector.detect(EntityType.PROJECT_METRIC, List.of(over, within), AnomalyContext.empty());

        assertEquals(1, flags.size());
        assertEquals("P001|H001", flags.get(0).getRecordKey());
    }

    @Test
    @DisplayName("Should raise nothing for entities without rules")
    void testDetect_NoRules() {
        assertTrue(detector.detect(EntityType.FINANCIAL_FILING, List.of(), AnomalyContext.empty()).isEmpty());
    }

    @Test
    @DisplayName("A rule should refuse a batch of another fact type")
    void testDetectIn_WrongRecordType() {
        LargeDonationRule rule = new LargeDonationRule(new BigDecimal("10000"));
        List<ElkPopulationFact> observations = List.of(observation("H001", 2022, 400, "-20.00"));

        assertEquals(DonationFact.class, rule.getRecordType());
        assertThrows(ClassCastException.class, () -> rule.detectIn(observations, AnomalyContext.empty()));
        assertEquals(1, rule.detectIn(List.of(donation("DN002", "15000.00")), AnomalyContext.empty()).size());
    }
}
