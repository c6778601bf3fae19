package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ProjectMetricFact;
import com.example.conservation.etl.model.Severity;

import java.util.List;
import java.util.stream.Collectors;

public class BudgetOverrunRule implements AnomalyRule<ProjectMetricFact> {

    @Override
    public String getRuleName() {
        return "budget-overrun";
    }

    @Override
    public Class<ProjectMetricFact> getRecordType() {
        return ProjectMetricFact.class;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PROJECT_METRIC;
    }

    @Override
    public List<AnomalyFlag> detect(List<ProjectMetricFact> batch, AnomalyContext context) {
        return batch.stream()
                .filter(m -> m.getBudget() != null && m.getSpentToDate() != null
                        && m.getSpentToDate().compareTo(m.getBudget()) > 0)
                .map(m -> new AnomalyFlag(EntityType.PROJECT_METRIC, m.getNaturalKey(), getRuleName(), Severity.WARNING,
                        m.getSpentToDate(), m.getBudget(),
                        "Project " + m.getProjectId() + " spent " + m.getSpentToDate().toPlainString()
                                + " of a " + m.getBudget().toPlainString() + " budget"))
                .collect(Collectors.toList());
    }
}
