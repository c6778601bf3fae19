package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.Severity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags the latest population observation of each habitat whose conservation status is at risk.
 */
public class HabitatAtRiskRule implements AnomalyRule<ElkPopulationFact> {

    private final Set<String> atRiskStatuses;

    public HabitatAtRiskRule(List<String> atRiskStatuses) {
        this.atRiskStatuses = atRiskStatuses.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public String getRuleName() {
        return "habitat-at-risk";
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
        Map<String, ElkPopulationFact> latest = new LinkedHashMap<>();
        batch.stream()
                .filter(o -> o.getHabitatId() != null && o.getObservationYear() != null)
                .forEach(o -> latest.merge(o.getHabitatId(), o,
                        (a, b) -> Comparator.comparing(ElkPopulationFact::getObservationYear).compare(a, b) >= 0 ? a : b));

        List<AnomalyFlag> flags = new ArrayList<>();
        latest.values().forEach(observation -> {
            String status = context.habitatStatus(observation.getHabitatId());
            if (status != null && atRiskStatuses.contains(status.trim().toLowerCase(Locale.ROOT))) {
                flags.add(new AnomalyFlag(EntityType.ELK_POPULATION, observation.getNaturalKey(), getRuleName(),
                        Severity.WARNING,
                        observation.getElkCount() == null ? null : BigDecimal.valueOf(observation.getElkCount()),
                        null,
                        "Habitat " + observation.getHabitatId() + " has conservation status '" + status + "'"));
            }
        });
        return flags;
    }
}
