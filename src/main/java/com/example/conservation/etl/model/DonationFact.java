package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class DonationFact extends FactRecord {
    private String donationId;
    private String donorId;
    private Long donorKey;
    private String campaignId;
    private Long campaignKey;
    private BigDecimal amount;
    private String paymentMethod;
    private Boolean recurring;
    private String notes;

    @Override
    public EntityType getEntityType() {
        return EntityType.DONATION;
    }

    @Override
    public String getNaturalKey() {
        return donationId;
    }

    @Override
    public List<ForeignKeyRef> getForeignKeys() {
        return List.of(
                new ForeignKeyRef("donor_id", EntityType.DONOR, donorId, donorKey, true),
                new ForeignKeyRef("campaign_id", EntityType.CAMPAIGN, campaignId, campaignKey, true));
    }
}
