package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@EqualsAndHashCode(callSuper = true)
public class CampaignDimension extends DimensionRecord {
    private String campaignId;
    private String campaignName;
    private String campaignType;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal goalAmount;
    private String description;
    private String targetRegion;
    private String status;

    @Override
    public EntityType getEntityType() {
        return EntityType.CAMPAIGN;
    }

    @Override
    public String getNaturalKey() {
        return campaignId;
    }
}
