package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Budget and impact measures of a conservation project, one row per associated habitat
 * (or a single row without habitat when the project lists none).
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ProjectMetricFact extends FactRecord {
    private String projectId;
    private Long projectKey;
    private String habitatId;
    private Long habitatKey;
    private BigDecimal budget;
    private BigDecimal spentToDate;
    private Long acresProtected;
    private Integer elkPopulationImpacted;

    @Override
    public EntityType getEntityType() {
        return EntityType.PROJECT_METRIC;
    }

    @Override
    public String getNaturalKey() {
        return projectId + "|" + (habitatId == null ? "-" : habitatId);
    }

    @Override
    public List<ForeignKeyRef> getForeignKeys() {
        return List.of(
                new ForeignKeyRef("project_id", EntityType.PROJECT, projectId, projectKey, true),
                new ForeignKeyRef("habitat_id", EntityType.HABITAT, habitatId, habitatKey, false));
    }
}
