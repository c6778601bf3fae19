package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class HabitatDimension extends DimensionRecord {
    private String habitatId;
    private String habitatName;
    private String state;
    private String region;
    private Long totalAcres;
    private Integer habitatQualityScore;
    private String conservationStatus; // Protected, Partially Protected, At Risk
    private String primaryThreats;     // JSON array text

    @Override
    public EntityType getEntityType() {
        return EntityType.HABITAT;
    }

    @Override
    public String getNaturalKey() {
        return habitatId;
    }
}
