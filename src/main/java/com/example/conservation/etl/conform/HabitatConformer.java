package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.HabitatDimension;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

@Component
public class HabitatConformer implements EntityConformer<HabitatDimension> {
    private final TypeCoercer coercer;

    public HabitatConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.HABITAT;
    }

    @Override
    public HabitatDimension conform(StagedRecord staged, DimensionLookups lookups) {
        HabitatDimension habitat = new HabitatDimension();
        habitat.setHabitatId(coercer.toText(staged, "habitat_id"));
        habitat.setHabitatName(coercer.toText(staged, "habitat_name"));
        habitat.setState(coercer.toText(staged, "state"));
        habitat.setRegion(coercer.toText(staged, "region"));
        habitat.setTotalAcres(coercer.toLong(staged, "total_acres"));
        habitat.setHabitatQualityScore(coercer.toInteger(staged, "habitat_quality_score"));
        habitat.setConservationStatus(coercer.toText(staged, "conservation_status"));
        habitat.setPrimaryThreats(coercer.toJsonText(staged, "primary_threats"));
        return habitat;
    }
}
