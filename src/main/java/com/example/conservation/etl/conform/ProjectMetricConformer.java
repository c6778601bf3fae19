package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ProjectMetricFact;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

/**
 * Conforms project budget and impact measures. Input is the project document flattened on
 * {@code habitat_ids}, so each record carries a single habitat id (or none).
 */
@Component
public class ProjectMetricConformer implements EntityConformer<ProjectMetricFact> {
    private final TypeCoercer coercer;

    public ProjectMetricConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PROJECT_METRIC;
    }

    @Override
    public ProjectMetricFact conform(StagedRecord staged, DimensionLookups lookups) {
        ProjectMetricFact metric = new ProjectMetricFact();
        metric.setProjectId(coercer.toText(staged, "project_id"));
        metric.setProjectKey(lookups.surrogateKey(EntityType.PROJECT, metric.getProjectId()));
        metric.setHabitatId(coercer.toText(staged, "habitat_ids"));
        metric.setHabitatKey(lookups.surrogateKey(EntityType.HABITAT, metric.getHabitatId()));
        metric.setBudget(coercer.toDecimal(staged, "budget"));
        metric.setSpentToDate(coercer.toDecimal(staged, "spent_to_date"));
        metric.setAcresProtected(coercer.toLong(staged, "acres_protected"));
        metric.setElkPopulationImpacted(coercer.toInteger(staged, "elk_population_impacted"));
        metric.setBusinessDate(coercer.toDate(staged, "start_date"));
        return metric;
    }
}
