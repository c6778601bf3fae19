package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the threshold rules for a fact entity. Flags are informational; no record is ever removed.
 */
@Component
public class AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final List<AnomalyRule<?>> rules;

    @Autowired
    public AnomalyDetector(EtlProperties properties) {
        this(List.of(
                new LargeDonationRule(properties.getAnomaly().getLargeDonationAmount()),
                new HabitatAtRiskRule(properties.getAnomaly().getAtRiskStatuses()),
                new PopulationDeclineRule(properties.getAnomaly().getPopulationDeclinePercent()),
                new BudgetOverrunRule()));
    }

    public AnomalyDetector(List<AnomalyRule<?>> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<AnomalyFlag> detect(EntityType entityType, List<? extends FactRecord> batch, AnomalyContext context) {
        List<AnomalyFlag> flags = new ArrayList<>();
        for (AnomalyRule<?> rule : rules) {
            if (rule.getEntityType() == entityType) {
                flags.addAll(rule.detectIn(batch, context));
            }
        }
        if (!flags.isEmpty()) {
            log.info("Flagged {} anomalies on {} {} records", flags.size(), batch.size(), entityType);
        }
        return flags;
    }
}
