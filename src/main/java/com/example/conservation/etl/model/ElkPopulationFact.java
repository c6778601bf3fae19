package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Yearly elk count for a habitat. Change measures are signed and relative to the
 * previous observed year of the same habitat; both are null for the first observation.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ElkPopulationFact extends FactRecord {
    private String habitatId;
    private Long habitatKey;
    private Integer observationYear;
    private Integer elkCount;
    private Integer populationChange;
    private BigDecimal populationChangePct;

    @Override
    public EntityType getEntityType() {
        return EntityType.ELK_POPULATION;
    }

    @Override
    public String getNaturalKey() {
        return habitatId + "|" + observationYear;
    }

    @Override
    public List<ForeignKeyRef> getForeignKeys() {
        return List.of(new ForeignKeyRef("habitat_id", EntityType.HABITAT, habitatId, habitatKey, true));
    }
}
