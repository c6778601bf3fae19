package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.CampaignDimension;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

@Component
public class CampaignConformer implements EntityConformer<CampaignDimension> {
    private final TypeCoercer coercer;

    public CampaignConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.CAMPAIGN;
    }

    @Override
    public CampaignDimension conform(StagedRecord staged, DimensionLookups lookups) {
        CampaignDimension campaign = new CampaignDimension();
        campaign.setCampaignId(coercer.toText(staged, "campaign_id"));
        campaign.setCampaignName(coercer.toText(staged, "campaign_name"));
        campaign.setCampaignType(coercer.toText(staged, "campaign_type"));
        campaign.setStartDate(coercer.toDate(staged, "start_date"));
        campaign.setEndDate(coercer.toDate(staged, "end_date"));
        campaign.setGoalAmount(coercer.toDecimal(staged, "goal_amount"));
        campaign.setDescription(coercer.toText(staged, "description"));
        campaign.setTargetRegion(coercer.toText(staged, "target_region"));
        campaign.setStatus(coercer.toText(staged, "status"));
        return campaign;
    }
}
