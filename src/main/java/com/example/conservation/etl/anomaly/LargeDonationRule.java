package com.example.conservation.etl.anomaly;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.Severity;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

public class LargeDonationRule implements AnomalyRule<DonationFact> {

    private final BigDecimal threshold;

    public LargeDonationRule(BigDecimal threshold) {
        this.threshold = threshold;
    }

    @Override
    public String getRuleName() {
        return "large-donation";
    }

    @Override
    public Class<DonationFact> getRecordType() {
        return DonationFact.class;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.DONATION;
    }

    @Override
    public List<AnomalyFlag> detect(List<DonationFact> batch, AnomalyContext context) {
        return batch.stream()
                .filter(d -> d.getAmount() != null && d.getAmount().compareTo(threshold) > 0)
                .map(d -> new AnomalyFlag(EntityType.DONATION, d.getNaturalKey(), getRuleName(), Severity.WARNING,
                        d.getAmount(), threshold,
                        "Donation of " + d.getAmount().toPlainString() + " from donor " + d.getDonorId()))
                .collect(Collectors.toList());
    }
}
