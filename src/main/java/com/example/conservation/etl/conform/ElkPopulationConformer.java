package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conforms one habitat/year elk count, from habitat documents flattened on their
 * {@code population_counts} array. Change measures compare each observation with the
 * previous observed year of the same habitat.
 */
@Component
public class ElkPopulationConformer implements EntityConformer<ElkPopulationFact> {
    private final TypeCoercer coercer;

    public ElkPopulationConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.ELK_POPULATION;
    }

    @Override
    public ElkPopulationFact conform(StagedRecord staged, DimensionLookups lookups) {
        ElkPopulationFact observation = new ElkPopulationFact();
        observation.setHabitatId(coercer.toText(staged, "habitat_id"));
        observation.setHabitatKey(lookups.surrogateKey(EntityType.HABITAT, observation.getHabitatId()));
        observation.setObservationYear(coercer.toInteger(staged, "year"));
        observation.setElkCount(coercer.toInteger(staged, "elk_count"));
        if (observation.getObservationYear() != null) {
            observation.setBusinessDate(LocalDate.of(observation.getObservationYear(), 12, 31));
        }
        return observation;
    }

    @Override
    public void completeBatch(List<ElkPopulationFact> records) {
        Map<String, List<ElkPopulationFact>> byHabitat = records.stream()
                .filter(r -> r.getHabitatId() != null && r.getObservationYear() != null)
                .collect(Collectors.groupingBy(ElkPopulationFact::getHabitatId));

        byHabitat.values().forEach(observations -> {
            observations.sort(Comparator.comparing(ElkPopulationFact::getObservationYear));
            ElkPopulationFact previous = null;
            for (ElkPopulationFact current : observations) {
                if (previous != null && previous.getElkCount() != null && current.getElkCount() != null
                        && !Objects.equals(previous.getObservationYear(), current.getObservationYear())) {
                    int change = current.getElkCount() - previous.getElkCount();
                    current.setPopulationChange(change);
                    if (previous.getElkCount() != 0) {
                        current.setPopulationChangePct(BigDecimal.valueOf(change * 100L)
                                .divide(BigDecimal.valueOf(previous.getElkCount()), 2, RoundingMode.HALF_UP));
                    }
                }
                previous = current;
            }
        });
    }
}
