package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.Severity;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Year-over-year change percentage below minus the configured decline.
 */
public class PopulationDeclineRule implements AnomalyRule<ElkPopulationFact> {

    private final BigDecimal threshold;

    public PopulationDeclineRule(BigDecimal declinePercent) {
        this.threshold = declinePercent.abs().negate();
    }

    @Override
    public String getRuleName() {
        return "population-decline";
    }

    @Override
    public Class<ElkPopulationFact> getRecordType() {
        return ElkPopulationFact.class;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.ELK_POPULATION;
    }

    @Override
    public List<AnomalyFlag> detect(List<ElkPopulationFact> batch, AnomalyContext context) {
        return batch.stream()
                .filter(o -> o.getPopulationChangePct() != null && o.getPopulationChangePct().compareTo(threshold) < 0)
                .map(o -> new AnomalyFlag(EntityType.ELK_POPULATION, o.getNaturalKey(), getRuleName(), Severity.WARNING,
                        o.getPopulationChangePct(), threshold,
                        "Habitat " + o.getHabitatId() + " changed " + o.getPopulationChangePct().toPlainString()
                                + "% to " + o.getElkCount() + " in " + o.getObservationYear()))
                .collect(Collectors.toList());
    }
}
